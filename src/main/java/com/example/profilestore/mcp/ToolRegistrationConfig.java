package com.example.profilestore.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final ProfileTools profileTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(ProfileTools profileTools, CapabilitiesTools capTools) {
        this.profileTools = profileTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(profileTools, capTools)
                .build();
    }
}
