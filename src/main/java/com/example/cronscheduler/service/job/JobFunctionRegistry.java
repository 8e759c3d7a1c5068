package com.example.cronscheduler.service.job;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry of job functions.
 * <p>
 * Discovers all {@link JobFunction} beans and indexes them by name and alias.
 */
@Slf4j
@Component
public class JobFunctionRegistry {

    private final Map<String, JobFunction> functions = new HashMap<>();
    private final List<JobFunction> functionBeans;

    public JobFunctionRegistry(List<JobFunction> functionBeans) {
        this.functionBeans = functionBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var function : functionBeans) {
            register(function.getName(), function);
            for (var alias : function.getAliases()) {
                register(alias, function);
            }
            log.info("Registered job function {} (aliases: {})", function.getName(), function.getAliases());
        }
        log.info("Job function registry initialized with {} functions", getFunctionCount());
    }

    private void register(String name, JobFunction function) {
        var previous = functions.put(name, function);
        if (previous != null && previous != function) {
            log.warn("Duplicate job function name {}: {} overrides {}",
                    name, function.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
    }

    public Optional<JobFunction> getFunction(String name) {
        return Optional.ofNullable(name).map(functions::get);
    }

    public boolean hasFunction(String name) {
        return getFunction(name).isPresent();
    }

    /**
     * Look up and invoke a function.
     * Exceptions thrown by the function are converted to a failed result.
     *
     * @param functionName Registered name or alias
     * @param context      Execution context
     * @return Result of the execution, failed for an unknown name
     */
    public JobResult execute(String functionName, JobContext context) {
        var function = getFunction(functionName);
        if (function.isEmpty()) {
            log.warn("Unknown job function: {}", functionName);
            return JobResult.failure("Unknown job function: " + functionName, "UNKNOWN_FUNCTION");
        }

        try {
            var result = function.get().execute(context);
            return result != null ? result : JobResult.success();
        } catch (Exception e) {
            log.error("Job function {} threw: {}", functionName, e.getMessage(), e);
            return JobResult.failure(e);
        }
    }

    /**
     * All registered names, aliases included
     */
    public Set<String> getRegisteredNames() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    public int getFunctionCount() {
        return functionBeans.size();
    }
}
