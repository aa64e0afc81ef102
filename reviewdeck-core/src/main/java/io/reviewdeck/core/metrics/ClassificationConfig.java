package io.reviewdeck.core.metrics;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationConfig(
    @JsonAlias({"proactive_type_ids"}) Set<Integer> proactiveTypeIds,
    @JsonAlias({"reactive_type_ids"}) Set<Integer> reactiveTypeIds
) {

    public ClassificationConfig {
        proactiveTypeIds = withoutNulls(proactiveTypeIds);
        reactiveTypeIds = withoutNulls(reactiveTypeIds);
    }

    public static ClassificationConfig defaults() {
        Set<Integer> reactive = Stream.concat(
                Stream.of(1, 10, 20, 50, 9999),
                IntStream.rangeClosed(60, 72).boxed()
            )
            .collect(Collectors.toSet());
        return new ClassificationConfig(Set.of(30, 40, 100), reactive);
    }

    private static Set<Integer> withoutNulls(Set<Integer> ids) {
        if (ids == null) {
            return Set.of();
        }
        return ids.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    public boolean isProactive(Integer typeId) {
        return typeId != null && proactiveTypeIds.contains(typeId);
    }

    public boolean isReactive(Integer typeId) {
        return typeId != null && !isProactive(typeId) && reactiveTypeIds.contains(typeId);
    }
}
