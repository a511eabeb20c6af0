package com.example.mcpinvoke.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "mcp.invoke")
public class McpInvokeProperties {

    private String path = "/mcp";

    private String serverName = "springboot-mcp-invoke";

    private String serverVersion = "0.0.1";

    private boolean includeControllerNameInToolName = true;

    private List<String> excludedControllers = new ArrayList<>();

    private boolean exposeComplexTypeProperties = true;

    private boolean legacyMethodDispatch = false;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getServerName() {
        return serverName;
    }

    public void setServerName(String serverName) {
        this.serverName = serverName;
    }

    public String getServerVersion() {
        return serverVersion;
    }

    public void setServerVersion(String serverVersion) {
        this.serverVersion = serverVersion;
    }

    public boolean isIncludeControllerNameInToolName() {
        return includeControllerNameInToolName;
    }

    public void setIncludeControllerNameInToolName(boolean includeControllerNameInToolName) {
        this.includeControllerNameInToolName = includeControllerNameInToolName;
    }

    public List<String> getExcludedControllers() {
        return excludedControllers;
    }

    public void setExcludedControllers(List<String> excludedControllers) {
        this.excludedControllers = excludedControllers;
    }

    public boolean isExposeComplexTypeProperties() {
        return exposeComplexTypeProperties;
    }

    public void setExposeComplexTypeProperties(boolean exposeComplexTypeProperties) {
        this.exposeComplexTypeProperties = exposeComplexTypeProperties;
    }

    public boolean isLegacyMethodDispatch() {
        return legacyMethodDispatch;
    }

    public void setLegacyMethodDispatch(boolean legacyMethodDispatch) {
        this.legacyMethodDispatch = legacyMethodDispatch;
    }
}
