package me.golemcore.browser.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.browser.domain.exception.ErrorKind;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.AgentRunRequest;
import me.golemcore.browser.domain.model.AgentRunResult;
import me.golemcore.browser.domain.model.AllowedDomains;
import me.golemcore.browser.domain.model.InteractiveElement;
import me.golemcore.browser.domain.service.BrowserSessionHandle;
import me.golemcore.browser.testsupport.FakeBrowserControlPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jBrowserAgentTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String EXAMPLE = "https://example.com";

    private OpenAiChatModelFactory modelFactory;
    private ChatModel chatModel;
    private FakeBrowserControlPort port;
    private BrowserSessionHandle handle;
    private Langchain4jBrowserAgent agent;

    @BeforeEach
    void setUp() {
        modelFactory = mock(OpenAiChatModelFactory.class);
        chatModel = mock(ChatModel.class);
        when(modelFactory.getModel(anyString())).thenReturn(chatModel);
        port = new FakeBrowserControlPort()
                .withPage(EXAMPLE, "Example Domain",
                        InteractiveElement.builder().index(0).tag("input").text("").placeholder("Search").build(),
                        InteractiveElement.builder().index(1).tag("a").text("More")
                                .href("https://www.iana.org/domains/example").build());
        handle = new BrowserSessionHandle("s1", port, AllowedDomains.unrestricted(), Duration.ZERO,
                Duration.ofSeconds(5));
        agent = new Langchain4jBrowserAgent(modelFactory, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    @Test
    void shouldApplyActionsUntilDone() {
        when(chatModel.chat(anyList())).thenReturn(
                reply("{\"action\": \"navigate\", \"url\": \"https://example.com\"}"),
                reply("{\"action\": \"type\", \"index\": 0, \"text\": \"golem\"}"),
                reply("{\"action\": \"key\", \"key\": \"Enter\"}"),
                reply("{\"action\": \"done\", \"success\": true, \"result\": \"Searched for golem\"}"));

        AgentRunResult result = agent.run(request(10, false), handle);

        assertTrue(result.isSuccessful());
        assertEquals("Searched for golem", result.getFinalResult());
        assertEquals(4, result.getStepsCompleted());
        assertEquals(List.of(EXAMPLE), result.getUrlsVisited());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(port.getCommands().contains("navigate " + EXAMPLE));
        assertTrue(port.getCommands().contains("type 0 golem"));
        assertTrue(port.getCommands().contains("key Enter"));
    }

    @Test
    void shouldStopAfterConsecutiveFailures() {
        when(chatModel.chat(anyList())).thenReturn(reply("I am not sure what to do"));

        AgentRunResult result = agent.run(request(10, false), handle);

        assertFalse(result.isSuccessful());
        assertEquals(Langchain4jBrowserAgent.MAX_CONSECUTIVE_FAILURES, result.getStepsCompleted());
        assertEquals(Langchain4jBrowserAgent.MAX_CONSECUTIVE_FAILURES + 1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).startsWith("Step 1: Model reply is not a JSON action"));
        assertEquals("Stopped after 3 consecutive failures",
                result.getErrors().get(result.getErrors().size() - 1));
    }

    @Test
    void shouldRecoverWhenFailuresAreNotConsecutive() {
        port.withPage("about:blank", "Blank");
        when(chatModel.chat(anyList())).thenReturn(
                reply("{\"action\": \"click\", \"index\": 42}"),
                reply("{\"action\": \"click\", \"index\": 42}"),
                reply("{\"action\": \"scroll\", \"direction\": \"down\"}"),
                reply("{\"action\": \"click\", \"index\": 42}"),
                reply("{\"action\": \"done\", \"result\": \"gave up scrolling\"}"));

        AgentRunResult result = agent.run(request(10, false), handle);

        assertTrue(result.isSuccessful());
        assertEquals(5, result.getStepsCompleted());
        assertEquals(List.of(
                "Step 1: Element with index 42 not found",
                "Step 2: Element with index 42 not found",
                "Step 4: Element with index 42 not found"), result.getErrors());
    }

    @Test
    void shouldReportUnsuccessfulRunWhenStepsRunOut() {
        when(chatModel.chat(anyList())).thenReturn(reply("{\"action\": \"scroll\", \"direction\": \"down\"}"));

        AgentRunResult result = agent.run(request(2, false), handle);

        assertFalse(result.isSuccessful());
        assertEquals(2, result.getStepsCompleted());
        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    void shouldCarryFailureReasonWhenModelGivesUp() {
        when(chatModel.chat(anyList()))
                .thenReturn(reply("{\"action\": \"done\", \"success\": false, \"result\": \"Login required\"}"));

        AgentRunResult result = agent.run(request(5, false), handle);

        assertFalse(result.isSuccessful());
        assertEquals(List.of("Login required"), result.getErrors());
    }

    @Test
    void shouldStopBeforeFirstStepWhenDeadlinePassed() {
        AgentRunRequest request = AgentRunRequest.builder()
                .taskId("task_1")
                .description("anything")
                .maxSteps(5)
                .model("gpt-4o")
                .deadline(NOW.minusSeconds(1))
                .build();

        AgentRunResult result = agent.run(request, handle);

        assertFalse(result.isSuccessful());
        assertEquals(0, result.getStepsCompleted());
        assertEquals(List.of("Deadline reached after 0 steps"), result.getErrors());
        verify(chatModel, never()).chat(anyList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldAttachScreenshotWhenVisionEnabled() {
        when(chatModel.chat(anyList())).thenReturn(reply("{\"action\": \"done\", \"result\": \"seen\"}"));

        agent.run(request(5, true), handle);

        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(messages.capture());
        UserMessage userMessage = (UserMessage) messages.getValue().get(1);
        assertTrue(userMessage.contents().stream().anyMatch(ImageContent.class::isInstance));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDescribePageWithoutScreenshotWhenVisionDisabled() {
        handle.navigate(EXAMPLE, false);
        when(chatModel.chat(anyList())).thenReturn(reply("{\"action\": \"done\", \"result\": \"seen\"}"));

        agent.run(request(5, false), handle);

        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(messages.capture());
        UserMessage userMessage = (UserMessage) messages.getValue().get(1);
        assertFalse(userMessage.contents().stream().anyMatch(ImageContent.class::isInstance));
        String prompt = userMessage.singleText();
        assertTrue(prompt.startsWith("Task: find the docs"));
        assertTrue(prompt.contains("Current URL: " + EXAMPLE));
        assertTrue(prompt.contains("[0] <input>  placeholder=\"Search\""));
        assertTrue(prompt.contains("[1] <a> More href=https://www.iana.org/domains/example"));
    }

    @Test
    void shouldTreatModelErrorsAsStepFailures() {
        when(chatModel.chat(anyList())).thenThrow(new IllegalStateException("429 Too Many Requests"));

        AgentRunResult result = agent.run(request(10, false), handle);

        assertFalse(result.isSuccessful());
        assertEquals("Step 1: LLM call failed: 429 Too Many Requests", result.getErrors().get(0));
    }

    @Test
    void shouldPropagateMissingCredentials() {
        when(modelFactory.getModel(anyString()))
                .thenThrow(OrchestrationException.upstream("OPENAI_API_KEY not set in config or environment"));

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> agent.run(request(5, false), handle));

        assertEquals(ErrorKind.UPSTREAM_FAILURE, error.getKind());
    }

    @Test
    void shouldParseActionSurroundedByProse() {
        JsonNode action = agent.parseAction("Sure! ```json\n{\"action\": \"back\"}\n``` Let me know.");

        assertEquals("back", action.get("action").asText());
    }

    @Test
    void shouldRejectJsonWithoutAction() {
        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> agent.parseAction("{\"url\": \"https://example.com\"}"));

        assertTrue(error.getMessage().startsWith("Model reply has no action"));
    }

    @Test
    void shouldDelegateAvailabilityToFactory() {
        when(modelFactory.isConfigured()).thenReturn(true);
        assertTrue(agent.isAvailable());

        when(modelFactory.isConfigured()).thenReturn(false);
        assertFalse(agent.isAvailable());
    }

    private static AgentRunRequest request(int maxSteps, boolean useVision) {
        return AgentRunRequest.builder()
                .taskId("task_1")
                .description("find the docs")
                .maxSteps(maxSteps)
                .model("gpt-4o")
                .useVision(useVision)
                .deadline(NOW.plusSeconds(600))
                .build();
    }

    private static ChatResponse reply(String text) {
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text))
                .build();
    }
}
