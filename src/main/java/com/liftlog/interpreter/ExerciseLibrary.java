package com.liftlog.interpreter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known exercises and the spoken names that map to them, so that "bench",
 * "bp" and "bench press" all land on {@code bench-press}. Names that match
 * nothing are not rejected; the interpreter turns them into a slug.
 */
public class ExerciseLibrary {

    public record Exercise(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("category") String category,
        @JsonProperty("aliases") List<String> aliases
    ) {
        public Exercise {
            aliases = aliases == null ? List.of() : List.copyOf(aliases);
        }
    }

    record Catalog(@JsonProperty("exercises") List<Exercise> exercises) {}

    private final Map<String, Exercise> byId = new LinkedHashMap<>();
    private final Map<String, Exercise> byName = new HashMap<>();

    public ExerciseLibrary(List<Exercise> exercises) {
        for (Exercise exercise : exercises) {
            if (byId.putIfAbsent(exercise.id(), exercise) != null) {
                throw new IllegalArgumentException("duplicate exercise id " + exercise.id());
            }
            byName.put(normalize(exercise.id()), exercise);
            byName.put(normalize(exercise.name()), exercise);
            exercise.aliases().forEach(alias -> byName.put(normalize(alias), exercise));
        }
    }

    /** Reads {@code {"exercises": [...]}} from the classpath. */
    public static ExerciseLibrary fromClasspath(String resource) {
        try (InputStream in = ExerciseLibrary.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("exercise library not found on classpath: " + resource);
            }
            return new ExerciseLibrary(new ObjectMapper().readValue(in, Catalog.class).exercises());
        } catch (IOException ex) {
            throw new UncheckedIOException("exercise library unreadable: " + resource, ex);
        }
    }

    public Optional<Exercise> lookup(String spoken) {
        return Optional.ofNullable(byName.get(normalize(spoken)));
    }

    public Collection<Exercise> exercises() {
        return byId.values();
    }

    /** Spaces, hyphens and underscores are interchangeable and case is ignored. */
    private static String normalize(String name) {
        return name.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " ");
    }
}
