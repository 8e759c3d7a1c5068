package com.example.cronscheduler.service.job;

import com.example.cronscheduler.domain.entity.JobMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobFunctionRegistry Tests")
class JobFunctionRegistryTest {

    private JobFunctionRegistry registry;

    private JobContext context;

    @BeforeEach
    void setUp() {
        registry = new JobFunctionRegistry(List.of(
                new StubFunction("syncCounts", Set.of("sync_counts"), ctx -> JobResult.success(Map.of("synced", 3))),
                new StubFunction("explode", Set.of(), ctx -> {
                    throw new IllegalStateException("database gone");
                }),
                new StubFunction("returnsNull", Set.of(), ctx -> null)));
        registry.initialize();

        context = JobContext.builder()
                .jobId(UUID.randomUUID())
                .jobName("test")
                .metadata(new JobMetadata())
                .now(Instant.parse("2024-06-12T10:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("Should resolve functions by name and alias")
        void shouldResolveByNameAndAlias() {
            assertThat(registry.hasFunction("syncCounts")).isTrue();
            assertThat(registry.hasFunction("sync_counts")).isTrue();
            assertThat(registry.getFunction("sync_counts")).containsSame(registry.getFunction("syncCounts").orElseThrow());
        }

        @Test
        @DisplayName("Should not resolve unknown or null names")
        void shouldNotResolveUnknown() {
            assertThat(registry.hasFunction("nope")).isFalse();
            assertThat(registry.getFunction(null)).isEmpty();
        }

        @Test
        @DisplayName("Should list names with aliases but count functions once")
        void shouldListNames() {
            assertThat(registry.getRegisteredNames()).containsExactly("explode", "returnsNull", "syncCounts", "sync_counts");
            assertThat(registry.getFunctionCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should return the function result")
        void shouldReturnResult() {
            var result = registry.execute("sync_counts", context);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getData()).containsEntry("synced", 3);
        }

        @Test
        @DisplayName("Should fail for an unknown function name")
        void shouldFailForUnknownFunction() {
            var result = registry.execute("doesNotExist", context);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorMessage()).isEqualTo("Unknown job function: doesNotExist");
            assertThat(result.getErrorType()).isEqualTo("UNKNOWN_FUNCTION");
        }

        @Test
        @DisplayName("Should convert a thrown exception into a failed result")
        void shouldConvertException() {
            var result = registry.execute("explode", context);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorMessage()).isEqualTo("database gone");
            assertThat(result.getErrorType()).isEqualTo("IllegalStateException");
            assertThat(result.getStackTrace()).contains("IllegalStateException");
        }

        @Test
        @DisplayName("Should treat a null result as success")
        void shouldTreatNullAsSuccess() {
            assertThat(registry.execute("returnsNull", context).isSuccess()).isTrue();
        }
    }

    private record StubFunction(String name, Set<String> aliases,
                                java.util.function.Function<JobContext, JobResult> body) implements JobFunction {

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Set<String> getAliases() {
            return aliases;
        }

        @Override
        public JobResult execute(JobContext context) {
            return body.apply(context);
        }
    }
}
