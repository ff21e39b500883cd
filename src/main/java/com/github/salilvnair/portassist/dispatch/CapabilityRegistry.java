package com.github.salilvnair.portassist.dispatch;

import com.github.salilvnair.portassist.config.PortAssistConfig;
import com.github.salilvnair.portassist.dispatch.remote.RemoteCapabilityHandlerFactory;
import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import com.github.salilvnair.portassist.intent.Intent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Intent routes and handler beans, resolved once at start-up and read-only
 * afterwards. A route may point at a handler that is not registered; that is
 * reported here and surfaces per turn as a configuration failure.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class CapabilityRegistry {

    private final PortAssistConfig config;
    private final List<CapabilityHandler> discoveredHandlers;
    private final RemoteCapabilityHandlerFactory remoteHandlerFactory;

    private Map<Intent, String> routes = Map.of();
    private Map<String, CapabilityHandler> handlersByName = Map.of();

    @PostConstruct
    public void init() {
        List<CapabilityHandler> all = new ArrayList<>();
        if (discoveredHandlers != null) {
            all.addAll(discoveredHandlers);
        }
        all.addAll(remoteHandlerFactory.create());

        Map<String, CapabilityHandler> byName = new LinkedHashMap<>();
        for (CapabilityHandler handler : all) {
            String name = handler.name();
            if (name == null || name.isBlank()) {
                throw new PortAssistException(
                        PortAssistErrorCode.INVALID_CAPABILITY_HANDLER,
                        "Capability handler without a name: " + handler.getClass().getName()
                );
            }
            if (byName.put(name.trim(), handler) != null) {
                throw new PortAssistException(
                        PortAssistErrorCode.DUPLICATE_CAPABILITY_HANDLER,
                        "Duplicate capability handler name: " + name
                );
            }
        }

        Map<Intent, String> routeTable = new EnumMap<>(Intent.class);
        Map<String, String> configured = config.getDispatch() == null ? Map.of() : config.getDispatch().getRoutes();
        if (configured != null) {
            configured.forEach((intentCode, handlerName) -> {
                Intent intent = Intent.fromCode(intentCode)
                        .filter(i -> !i.isMeta())
                        .orElseThrow(() -> new PortAssistException(
                                PortAssistErrorCode.INVALID_ROUTE,
                                "Route configured for unknown or meta intent: " + intentCode
                        ));
                if (handlerName == null || handlerName.isBlank()) {
                    return;
                }
                routeTable.put(intent, handlerName.trim());
            });
        }

        routeTable.forEach((intent, handlerName) -> {
            if (!byName.containsKey(handlerName)) {
                log.error("Route {} -> {} names a handler that is not registered", intent, handlerName);
            }
        });

        this.handlersByName = Collections.unmodifiableMap(byName);
        this.routes = Collections.unmodifiableMap(routeTable);
        log.info("PortAssist capability routes: {} (handlers: {})", routes, handlersByName.keySet());
    }

    public Optional<String> handlerNameFor(Intent intent) {
        return Optional.ofNullable(routes.get(intent));
    }

    public Optional<CapabilityHandler> handler(String name) {
        return Optional.ofNullable(handlersByName.get(name));
    }

    public Map<Intent, String> routes() {
        return routes;
    }
}
