package com.example.mcpinvoke.config;

import com.example.mcpinvoke.binding.ParameterBinder;
import com.example.mcpinvoke.model.DiscoveredOperation;
import com.example.mcpinvoke.protocol.McpErrorMapper;
import com.example.mcpinvoke.protocol.McpRequestDispatcher;
import com.example.mcpinvoke.protocol.McpServerContext;
import com.example.mcpinvoke.schema.BindingSourceInspector;
import com.example.mcpinvoke.schema.SchemaGenerator;
import com.example.mcpinvoke.schema.SourceInferencePolicy;
import com.example.mcpinvoke.schema.SpringBindingSourceInspector;
import com.example.mcpinvoke.service.McpToolsService;
import com.example.mcpinvoke.service.ToolInvoker;
import com.example.mcpinvoke.tool.HandlerResolver;
import com.example.mcpinvoke.tool.SpringHandlerResolver;
import com.example.mcpinvoke.tool.SpringMvcToolDefinitionSource;
import com.example.mcpinvoke.tool.ToolDefinitionSource;
import com.example.mcpinvoke.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

@Configuration
@EnableConfigurationProperties(McpInvokeProperties.class)
public class McpInvokeConfiguration {

    @Bean
    BindingSourceInspector bindingSourceInspector() {
        return new SpringBindingSourceInspector();
    }

    @Bean
    SchemaGenerator schemaGenerator(BindingSourceInspector inspector, ObjectMapper objectMapper,
                                    McpInvokeProperties properties) {
        return new SchemaGenerator(inspector, objectMapper, SourceInferencePolicy.DEFAULT,
                properties.isExposeComplexTypeProperties());
    }

    @Bean
    SpringMvcToolDefinitionSource springMvcToolDefinitionSource(
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping,
            McpInvokeProperties properties) {
        return new SpringMvcToolDefinitionSource(handlerMapping,
                properties.isIncludeControllerNameInToolName(), properties.getExcludedControllers());
    }

    @Bean
    ToolRegistry toolRegistry(List<ToolDefinitionSource> sources, SchemaGenerator schemaGenerator) {
        List<DiscoveredOperation> operations = new ArrayList<>();
        sources.forEach(source -> operations.addAll(source.discover()));
        return ToolRegistry.build(operations, schemaGenerator);
    }

    @Bean
    HandlerResolver handlerResolver(AutowireCapableBeanFactory beanFactory) {
        return new SpringHandlerResolver(beanFactory);
    }

    @Bean
    McpErrorMapper mcpErrorMapper() {
        return new McpErrorMapper();
    }

    @Bean
    ToolInvoker toolInvoker(HandlerResolver handlerResolver, ObjectMapper objectMapper,
                            ObjectProvider<AsyncTaskExecutor> executorProvider) {
        AsyncTaskExecutor taskExecutor = executorProvider.getIfUnique();
        Executor executor = taskExecutor != null ? taskExecutor : ForkJoinPool.commonPool();
        return new ToolInvoker(handlerResolver, objectMapper, executor);
    }

    @Bean
    McpToolsService mcpToolsService(ToolRegistry toolRegistry, ObjectMapper objectMapper,
                                    ToolInvoker toolInvoker, McpErrorMapper errorMapper) {
        return new McpToolsService(toolRegistry, new ParameterBinder(objectMapper), toolInvoker, errorMapper);
    }

    @Bean
    McpServerContext mcpServerContext(McpInvokeProperties properties, McpToolsService toolsService) {
        return new McpServerContext(properties.getServerName(), properties.getServerVersion(),
                toolsService, properties.isLegacyMethodDispatch());
    }

    @Bean
    McpRequestDispatcher mcpRequestDispatcher(McpServerContext context, McpErrorMapper errorMapper,
                                              ObjectMapper objectMapper) {
        return new McpRequestDispatcher(context, errorMapper, objectMapper);
    }
}
