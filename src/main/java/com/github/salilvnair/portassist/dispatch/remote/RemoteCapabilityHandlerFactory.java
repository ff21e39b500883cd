package com.github.salilvnair.portassist.dispatch.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.portassist.config.PortAssistConfig;
import com.github.salilvnair.portassist.dispatch.CapabilityHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one {@link RemoteCapabilityHandler} per
 * {@code portassist.remote.handlers.<name>} entry.
 */
@RequiredArgsConstructor
@Component
public class RemoteCapabilityHandlerFactory {

    private final PortAssistConfig config;
    private final ObjectMapper mapper;

    public List<CapabilityHandler> create() {
        PortAssistConfig.Remote remote = config.getRemote();
        List<CapabilityHandler> handlers = new ArrayList<>();
        if (remote == null || remote.getHandlers() == null) {
            return handlers;
        }
        for (Map.Entry<String, PortAssistConfig.Remote.Handler> entry : remote.getHandlers().entrySet()) {
            PortAssistConfig.Remote.Handler handler = entry.getValue();
            PortAssistConfig.Remote.Policy policy = handler.getPolicy() != null
                    ? handler.getPolicy()
                    : remote.getDefaults();
            handlers.add(new RemoteCapabilityHandler(
                    entry.getKey(),
                    handler.getUrl(),
                    RemoteExecutionPolicy.fromConfig(policy),
                    mapper
            ));
        }
        return handlers;
    }
}
