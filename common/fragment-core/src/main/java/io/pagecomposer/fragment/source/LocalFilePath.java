package io.pagecomposer.fragment.source;

import io.pagecomposer.fragment.RenderContext;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A local file path joined from fixed parts and parts computed from the request context.
 */
public final class LocalFilePath implements SourceLocator {

    /**
     * One computed section of the path.
     */
    @FunctionalInterface
    public interface PathPart {
        String resolve(RenderContext context);
    }

    private final List<PathPart> parts;
    private final List<String> descriptions;

    public LocalFilePath(List<PathPart> parts) {
        Objects.requireNonNull(parts, "parts");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("a local file path needs at least one part");
        }
        this.parts = List.copyOf(parts);
        this.descriptions = List.of();
    }

    private LocalFilePath(List<PathPart> parts, List<String> descriptions) {
        this.parts = List.copyOf(parts);
        this.descriptions = List.copyOf(descriptions);
    }

    public static LocalFilePath of(String... literalParts) {
        Objects.requireNonNull(literalParts, "literalParts");
        if (literalParts.length == 0) {
            throw new IllegalArgumentException("a local file path needs at least one part");
        }
        List<PathPart> parts = new ArrayList<>(literalParts.length);
        for (String part : literalParts) {
            Objects.requireNonNull(part, "part");
            parts.add(context -> part);
        }
        return new LocalFilePath(parts, List.of(literalParts));
    }

    /**
     * Resolves the path relative to the current working directory.
     */
    public Path resolve(RenderContext context) {
        return resolve(context, Path.of("").toAbsolutePath());
    }

    /**
     * Resolves the path, joining it onto {@code workingDirectory} when one is given. Parameters are
     * interpolated after joining.
     */
    public Path resolve(RenderContext context, Path workingDirectory) {
        RenderContext safeContext = context == null ? RenderContext.empty() : context;
        List<String> resolved = parts.stream()
            .map(part -> part.resolve(safeContext))
            .collect(Collectors.toList());
        Path joined = Path.of(resolved.get(0), resolved.subList(1, resolved.size()).toArray(new String[0]));
        if (workingDirectory != null) {
            joined = workingDirectory.resolve(joined);
        }
        return Path.of(PathParameters.apply(joined.normalize().toString(), safeContext.params()));
    }

    @Override
    public String toString() {
        Object description = descriptions.isEmpty() ? "<computed>" : String.join(",", descriptions);
        return "Url.LocalFile(" + description + ")";
    }
}
