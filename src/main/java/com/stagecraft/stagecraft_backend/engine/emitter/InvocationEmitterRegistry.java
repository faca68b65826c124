package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One emitter per {@link NodeRole}. Two emitters claiming the same role is a wiring
 * error and fails startup.
 */
@Component
@RequiredArgsConstructor
public class InvocationEmitterRegistry {

    private final List<InvocationEmitter> emitters;
    private final Map<NodeRole, InvocationEmitter> byRole = new EnumMap<>(NodeRole.class);

    @PostConstruct
    public void init() {
        for (InvocationEmitter emitter : emitters) {
            InvocationEmitter previous = byRole.putIfAbsent(emitter.supportedRole(), emitter);
            if (previous != null) {
                throw new IllegalStateException("Both " + previous.getClass().getSimpleName() + " and "
                        + emitter.getClass().getSimpleName() + " emit role " + emitter.supportedRole());
            }
        }
    }

    public Optional<InvocationEmitter> find(NodeRole role) {
        return Optional.ofNullable(byRole.get(role));
    }
}
