package com.example.mcpinvoke.service;

import com.example.mcpinvoke.model.DiscoveredOperation;
import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.protocol.ErrorKind;
import com.example.mcpinvoke.protocol.McpException;
import com.example.mcpinvoke.schema.SchemaGenerator;
import com.example.mcpinvoke.schema.SpringBindingSourceInspector;
import com.example.mcpinvoke.support.ToolFixtures;
import com.example.mcpinvoke.tool.HandlerResolver;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ToolInvokerTest {

    private final HandlerResolver handlerResolver = mock(HandlerResolver.class);
    private final ToolInvoker invoker = new ToolInvoker(handlerResolver, ToolFixtures.OBJECT_MAPPER, Runnable::run);

    @Test
    void staticMethodResultIsWrappedAsTextContent() {
        Map<String, Object> result = invoker.invoke(ToolFixtures.tool("add"), new Object[]{2, 3}).join();

        assertThat(result).isEqualTo(Map.of("content", List.of(Map.of("type", "text", "text", "5"))));
        verifyNoInteractions(handlerResolver);
    }

    @Test
    void instanceMethodIsCalledOnResolvedHandler() throws Exception {
        RegisteredTool tool = instanceTool(GreetingHandler.class, "greet");
        when(handlerResolver.resolve(GreetingHandler.class)).thenReturn(new GreetingHandler("Hello"));

        Map<String, Object> result = invoker.invoke(tool, new Object[]{"Ada"}).join();

        assertThat(text(result)).isEqualTo("\"Hello, Ada\"");
    }

    @Test
    void nonSuccessResponseEntityIsAnExecutionFailure() {
        CompletableFuture<Map<String, Object>> result = invoker.invoke(ToolFixtures.tool("rejected"), new Object[0]);

        assertThatThrownBy(result::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOfSatisfying(McpException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.EXECUTION_FAILURE);
                    assertThat(ex.getCode()).isEqualTo(-32000);
                    assertThat((Map<String, Object>) ex.getData())
                            .containsEntry("status", 409)
                            .containsEntry("body", Map.of("reason", "conflict"));
                });
    }

    @Test
    void envelopesAndOptionalsAreUnwrapped() {
        Map<String, Object> result = invoker.invoke(ToolFixtures.tool("accepted"), new Object[]{"ok"}).join();

        assertThat(text(result)).isEqualTo("\"ok\"");
    }

    @Test
    void asynchronousResultsAreAwaited() {
        assertThat(text(invoker.invoke(ToolFixtures.tool("upper"), new Object[]{"mcp"}).join())).isEqualTo("\"MCP\"");
        assertThat(text(invoker.invoke(ToolFixtures.tool("length"), new Object[]{"four"}).join())).isEqualTo("4");
        assertThat(text(invoker.invoke(ToolFixtures.tool("deferred"), new Object[]{"x"}).join())).isEqualTo("\"deferred x\"");
    }

    @Test
    void hostExceptionsSurfaceUnwrapped() {
        CompletableFuture<Map<String, Object>> result = invoker.invoke(ToolFixtures.tool("explode"), new Object[]{"boom"});

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join)
                .cause()
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void cancellingTheResultCancelsTheHostFuture() throws Exception {
        RegisteredTool tool = instanceTool(PendingHandler.class, "await");
        PendingHandler handler = new PendingHandler();
        when(handlerResolver.resolve(PendingHandler.class)).thenReturn(handler);

        CompletableFuture<Map<String, Object>> result = invoker.invoke(tool, new Object[0]);
        result.cancel(true);

        assertThat(handler.pending.isCancelled()).isTrue();
    }

    private static RegisteredTool instanceTool(Class<?> type, String methodName) throws NoSuchMethodException {
        Method method = Arrays.stream(type.getDeclaredMethods())
                .filter(candidate -> candidate.getName().equals(methodName))
                .findFirst()
                .orElseThrow(NoSuchMethodException::new);
        return new SchemaGenerator(new SpringBindingSourceInspector(), ToolFixtures.OBJECT_MAPPER)
                .generate(new DiscoveredOperation(type.getSimpleName() + "_" + methodName, null, type, method, List.of()));
    }

    private static String text(Map<String, Object> result) {
        List<Map<String, Object>> content = (List<Map<String, Object>>) result.get("content");
        return (String) content.get(0).get("text");
    }

    public static class GreetingHandler {
        private final String greeting;

        public GreetingHandler(String greeting) {
            this.greeting = greeting;
        }

        public String greet(String name) {
            return greeting + ", " + name;
        }
    }

    public static class PendingHandler {
        private final CompletableFuture<String> pending = new CompletableFuture<>();

        public CompletableFuture<String> await() {
            return pending;
        }
    }
}
