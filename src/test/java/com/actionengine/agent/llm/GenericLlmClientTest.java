package com.actionengine.agent.llm;

import com.actionengine.agent.config.ToolProperties;
import com.actionengine.agent.exception.AgentException;
import com.actionengine.agent.exception.ContentPolicyException;
import com.actionengine.agent.exception.ModelUnavailableException;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.tool.ToolDefinition;
import com.actionengine.agent.tool.impl.TerminalTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenericLlmClientTest {

    private static final String URL = "https://llm.test/v1/chat/completions";

    private MockRestServiceServer server;
    private GenericLlmClient client;
    private final List<ToolDefinition> tools = List.of(ToolDefinition.from(new TerminalTool(new ToolProperties())));
    private final List<Message> messages = List.of(Message.system("You are an agent"), Message.user("delete x"));

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setApiKey("test-key");
        props.setBaseUrl("https://llm.test/v1");
        props.setModel("test-model");
        props.setMaxTokens(512);
        props.setTemperature(0.1);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GenericLlmClient(props, new ObjectMapper(), "groq", builder);
    }

    @Test
    void chat_parsesToolCallsAndUsage() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.tools[0].function.name").value("terminal"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andRespond(withSuccess("""
                        {"choices": [{"finish_reason": "tool_calls", "message": {
                            "content": "Deleting the file",
                            "tool_calls": [{"id": "call_1", "type": "function",
                                "function": {"name": "terminal", "arguments": "{\\"script\\": \\"rm x\\"}"}}]}}],
                         "usage": {"prompt_tokens": 120, "completion_tokens": 15}}
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(messages, tools);

        server.verify();
        assertThat(response.getContent()).isEqualTo("Deleting the file");
        assertThat(response.getToolCalls()).hasSize(1);
        assertThat(response.getToolCalls().get(0).getId()).isEqualTo("call_1");
        assertThat(response.getToolCalls().get(0).stringArgument("script")).isEqualTo("rm x");
        assertThat(response.getPromptTokens()).isEqualTo(120);
        assertThat(response.getCompletionTokens()).isEqualTo(15);
    }

    @Test
    void chat_malformedArguments_dropsCall() {
        server.expect(requestTo(URL)).andRespond(withSuccess("""
                {"choices": [{"message": {"content": null,
                    "tool_calls": [{"id": "call_1", "function": {"name": "terminal", "arguments": "{not json"}}]}}]}
                """, MediaType.APPLICATION_JSON));

        assertThat(client.chat(messages, tools).hasToolCalls()).isFalse();
    }

    @Test
    void chat_rateLimited_isModelUnavailable() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\": {\"message\": \"slow down\"}}"));

        assertThatThrownBy(() -> client.chat(messages, tools))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("rate limit");
    }

    @Test
    void chat_serverError_isModelUnavailable() {
        server.expect(requestTo(URL)).andRespond(withServerError().body("overloaded"));

        assertThatThrownBy(() -> client.chat(messages, tools)).isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    void chat_contentPolicy_isNotRetryable() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\": {\"code\": \"content_filter\"}}"));

        assertThatThrownBy(() -> client.chat(messages, tools)).isInstanceOf(ContentPolicyException.class);
    }

    @Test
    void chat_invalidKey_isAgentException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\": {\"code\": \"invalid_api_key\"}}"));

        assertThatThrownBy(() -> client.chat(messages, tools))
                .isExactlyInstanceOf(AgentException.class)
                .hasMessageContaining("GROQ_API_KEY");
    }

    @Test
    void chat_toolUseFailed_recoversXmlCalls() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("""
                        {"error": {"code": "tool_use_failed",
                         "failed_generation": "<function=terminal{\\"script\\": \\"ls -la\\"}></function>"}}
                        """));

        LlmResponse response = client.chat(messages, tools);

        assertThat(response.getToolCalls()).hasSize(1);
        assertThat(response.getToolCalls().get(0).getToolName()).isEqualTo("terminal");
        assertThat(response.getToolCalls().get(0).stringArgument("script")).isEqualTo("ls -la");
        assertThat(response.getToolCalls().get(0).getId()).startsWith("groq-recovered-");
    }
}
