package org.neuralchilli.cellflow.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.cellflow.domain.CacheExcluded;
import org.neuralchilli.cellflow.domain.CacheKey;
import org.neuralchilli.cellflow.domain.LoadedModel;
import org.neuralchilli.cellflow.domain.StageArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes the cache key of a task invocation.
 * <p>
 * Only identity-bearing arguments are hashed. Gates and loaded models are
 * left out: two invocations that differ only in those produce the same key,
 * which is what lets a later run reuse an earlier run's artifacts.
 * Arguments are canonicalized as JSON with sorted keys before hashing;
 * {@link CacheExcluded} carries {@code @JsonIgnore}, so excluded components
 * never reach the canonical form.
 */
@ApplicationScoped
public class CacheKeyGenerator {

    private static final Logger log = LoggerFactory.getLogger(CacheKeyGenerator.class);

    private static final Set<Class<?>> EXCLUDED_TYPES = Set.of(ResourceGate.class, LoadedModel.class);

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /**
     * Key for a stage's typed arguments.
     *
     * @throws InvalidTaskException if an excluded-type component is unmarked
     *                              or a value cannot be canonicalized
     */
    public CacheKey keyFor(StageArguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("Arguments cannot be null");
        }
        return keyForRecord((Record) arguments);
    }

    /**
     * Key for any argument record.
     * Components marked {@link CacheExcluded} are skipped; a component whose
     * declared type is a gate or a model must carry the annotation.
     *
     * @throws InvalidTaskException if an excluded-type component is unmarked
     *                              or a value cannot be canonicalized
     */
    public CacheKey keyForRecord(Record arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("Arguments cannot be null");
        }

        List<BeanPropertyDefinition> properties = canonicalMapper.getSerializationConfig()
                .introspect(canonicalMapper.constructType(arguments.getClass()))
                .findProperties();
        for (BeanPropertyDefinition property : properties) {
            if (isExcludedType(property.getRawPrimaryType())) {
                throw new InvalidTaskException(
                        "Argument '" + property.getName() + "' of " + arguments.getClass().getSimpleName()
                                + " has type " + property.getRawPrimaryType().getSimpleName()
                                + " and must be marked @CacheExcluded"
                );
            }
        }

        return properties.isEmpty() ? CacheKey.EMPTY : digest(arguments);
    }

    /**
     * Key for dynamically assembled named arguments.
     * Values whose runtime type is a gate or a model are dropped; map order
     * does not affect the result.
     */
    public CacheKey keyFor(Map<String, ?> arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("Arguments cannot be null");
        }

        SortedMap<String, Object> identity = new TreeMap<>();
        arguments.forEach((name, value) -> {
            if (value != null && isExcludedType(value.getClass())) {
                log.trace("Excluding argument '{}' ({}) from cache key", name, value.getClass().getSimpleName());
                return;
            }
            identity.put(name, value);
        });

        return identity.isEmpty() ? CacheKey.EMPTY : digest(identity);
    }

    /**
     * Whether values of this type never take part in a cache key.
     */
    public boolean isExcludedType(Class<?> type) {
        for (Class<?> excluded : EXCLUDED_TYPES) {
            if (excluded.isAssignableFrom(type)) {
                return true;
            }
        }
        return false;
    }

    private CacheKey digest(Object identity) {
        byte[] canonical;
        try {
            canonical = canonicalMapper.writeValueAsBytes(identity);
        } catch (JsonProcessingException e) {
            throw new InvalidTaskException(
                    "Arguments of " + identity.getClass().getSimpleName()
                            + " cannot be canonicalized for hashing: " + e.getOriginalMessage(),
                    e
            );
        }

        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return CacheKey.fromDigest(sha256.digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
