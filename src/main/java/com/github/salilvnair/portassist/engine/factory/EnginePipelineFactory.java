package com.github.salilvnair.portassist.engine.factory;

import com.github.salilvnair.portassist.engine.exception.PortAssistErrorCode;
import com.github.salilvnair.portassist.engine.exception.PortAssistException;
import com.github.salilvnair.portassist.engine.model.StepTiming;
import com.github.salilvnair.portassist.engine.pipeline.EnginePipeline;
import com.github.salilvnair.portassist.engine.pipeline.EngineStep;
import com.github.salilvnair.portassist.engine.pipeline.StepResult;
import com.github.salilvnair.portassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.portassist.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.portassist.engine.session.EngineSession;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Orders the {@link EngineStep} beans by their {@link MustRunAfter} constraints,
 * with the single {@link TerminalStep} last, and wraps each in a timing step.
 * Ties break by class name.
 */
@RequiredArgsConstructor
@Component
public class EnginePipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(EnginePipelineFactory.class);

    private final List<EngineStep> discoveredSteps;

    private EnginePipeline pipeline;

    @PostConstruct
    public void init() {
        List<EngineStep> ordered = orderByDag(discoveredSteps);
        logOrder(ordered);
        this.pipeline = new EnginePipeline(wrapWithTiming(ordered));
    }

    public EnginePipeline create() {
        return pipeline;
    }

    private List<EngineStep> orderByDag(List<EngineStep> steps) {

        Map<Class<?>, EngineStep> stepByClass = new HashMap<>();
        for (EngineStep s : steps) {
            if (stepByClass.put(s.getClass(), s) != null) {
                throw new PortAssistException(
                        PortAssistErrorCode.DUPLICATE_ENGINE_STEP,
                        "Duplicate EngineStep bean for class: " + s.getClass().getName()
                );
            }
        }

        List<Class<?>> terminalSteps = stepByClass.keySet().stream()
                .filter(c -> c.getAnnotation(TerminalStep.class) != null)
                .toList();

        if (terminalSteps.size() != 1) {
            throw new PortAssistException(
                    PortAssistErrorCode.MISSING_TERMINAL_STEP,
                    "Exactly ONE @TerminalStep required, found: " +
                            terminalSteps.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(", "))
            );
        }

        Class<?> terminal = terminalSteps.get(0);

        Map<Class<?>, Set<Class<?>>> outgoing = new HashMap<>();
        Map<Class<?>, Set<Class<?>>> incoming = new HashMap<>();

        for (Class<?> c : stepByClass.keySet()) {
            outgoing.put(c, new LinkedHashSet<>());
            incoming.put(c, new LinkedHashSet<>());
        }

        // @MustRunAfter(B) on A gives the edge B -> A
        for (Class<?> c : stepByClass.keySet()) {
            MustRunAfter after = c.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends EngineStep> a : after.value()) {
                    requirePresent(stepByClass, c, a);
                    addEdge(outgoing, incoming, a, c);
                }
            }
        }

        for (Class<?> c : stepByClass.keySet()) {
            if (!c.equals(terminal)) {
                addEdge(outgoing, incoming, c, terminal);
            }
        }

        List<Class<?>> sorted = topoSort(stepByClass.keySet(), outgoing, incoming);

        return sorted.stream().map(stepByClass::get).toList();
    }

    private void requirePresent(Map<Class<?>, EngineStep> stepByClass,
                                Class<?> owner,
                                Class<?> dep) {
        if (!stepByClass.containsKey(dep)) {
            throw new PortAssistException(
                    PortAssistErrorCode.MISSING_DEPENDENT_STEP,
                    owner.getSimpleName() + " depends on missing step: " + dep.getName()
            );
        }
    }

    private void addEdge(Map<Class<?>, Set<Class<?>>> outgoing,
                         Map<Class<?>, Set<Class<?>>> incoming,
                         Class<?> from,
                         Class<?> to) {
        if (from.equals(to)) return;
        if (outgoing.get(from).add(to)) {
            incoming.get(to).add(from);
        }
    }

    private List<Class<?>> topoSort(Set<Class<?>> nodes,
                                    Map<Class<?>, Set<Class<?>>> outgoing,
                                    Map<Class<?>, Set<Class<?>>> incoming) {

        Map<Class<?>, Integer> indegree = new HashMap<>();
        for (Class<?> n : nodes) {
            indegree.put(n, incoming.get(n).size());
        }

        PriorityQueue<Class<?>> q =
                new PriorityQueue<>(Comparator.comparing(Class::getName));

        indegree.forEach((k, v) -> {
            if (v == 0) q.add(k);
        });

        List<Class<?>> result = new ArrayList<>();

        while (!q.isEmpty()) {
            Class<?> n = q.poll();
            result.add(n);

            for (Class<?> m : outgoing.get(n)) {
                indegree.put(m, indegree.get(m) - 1);
                if (indegree.get(m) == 0) q.add(m);
            }
        }

        if (result.size() != nodes.size()) {
            Set<Class<?>> remaining = new LinkedHashSet<>(nodes);
            result.forEach(remaining::remove);
            throw new PortAssistException(
                    PortAssistErrorCode.STEP_DAG_CYCLE,
                    "EngineStep DAG cycle or unsatisfied constraints: " +
                            remaining.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(" -> "))
            );
        }

        return result;
    }

    private void logOrder(List<EngineStep> ordered) {
        log.info(
                "PortAssist pipeline order: {}",
                ordered.stream()
                        .map(s -> s.getClass().getSimpleName())
                        .collect(Collectors.joining(" -> "))
        );
    }

    private List<EngineStep> wrapWithTiming(List<EngineStep> steps) {
        return steps.stream()
                .map(s -> (EngineStep) new TimingEngineStep(s))
                .toList();
    }

    private static final class TimingEngineStep implements EngineStep {

        private final EngineStep delegate;

        private TimingEngineStep(EngineStep delegate) {
            this.delegate = delegate;
        }

        @Override
        public StepResult execute(EngineSession session) {
            long start = System.nanoTime();
            String stepName = delegate.getClass().getSimpleName();

            StepTiming timing = StepTiming.builder()
                    .stepName(stepName)
                    .startedAtNs(start)
                    .success(false)
                    .build();

            try {
                StepResult r = delegate.execute(session);
                long end = System.nanoTime();
                timing.setEndedAtNs(end);
                timing.setDurationMs((end - start) / 1_000_000);
                timing.setSuccess(true);
                session.getStepTimings().add(timing);
                log.debug("[{}] {} -> {} in {}ms",
                        session.shortTraceId(), stepName, r.getClass().getSimpleName(), timing.getDurationMs());
                return r;
            } catch (RuntimeException e) {
                long end = System.nanoTime();
                timing.setEndedAtNs(end);
                timing.setDurationMs((end - start) / 1_000_000);
                timing.setError(e.getClass().getSimpleName() + ": " + e.getMessage());
                session.getStepTimings().add(timing);
                log.error("[{}] {} failed after {}ms: {}",
                        session.shortTraceId(), stepName, timing.getDurationMs(), timing.getError());
                throw e;
            }
        }
    }
}
