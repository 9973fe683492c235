package io.pagecomposer.fragment.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pagecomposer.fragment.FetchOptions;
import io.pagecomposer.fragment.Fragment;
import io.pagecomposer.fragment.error.EmptyBodyException;
import io.pagecomposer.fragment.error.FragmentRenderException;
import io.pagecomposer.fragment.error.InvalidRepeatSourceException;
import io.pagecomposer.fragment.error.MissingDataSourceException;
import io.pagecomposer.fragment.error.MissingTemplateSpecificationException;
import io.pagecomposer.fragment.error.UnknownFragmentReferenceException;
import io.pagecomposer.templating.TemplateRenderer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The fragment compositor. Expands {@code <fragment-inject>} markers recursively: every marker found
 * at one level is resolved and rendered concurrently, then the text is rebuilt by offset.
 * <p>
 * Failures come in two kinds. Configuration errors (unknown names, missing template, bad repeat or
 * data sources) and failures of required fragments complete the render exceptionally. Failures to
 * render an optional fragment are replaced by that fragment's render error message.
 * <p>
 * The renderer keeps no state between calls apart from the request scoped {@link FragmentManager}.
 */
public final class Renderer {

    public static final int MAX_DEPTH = 5;

    static final String CURRENT = "current";
    static final String MODEL = "model";

    private static final Logger log = LoggerFactory.getLogger(Renderer.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final FragmentManager manager;
    private final TemplateRenderer templateRenderer;

    public Renderer(FragmentManager manager, TemplateRenderer templateRenderer) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer");
    }

    /**
     * Expands every marker in {@code body}. Past {@link #MAX_DEPTH} the body is returned as is.
     */
    public CompletableFuture<String> renderRecursive(String body, int currentDepth) {
        if (currentDepth > MAX_DEPTH) {
            log.error("Max render depth {} has been reached, rendering will stop", MAX_DEPTH);
            return CompletableFuture.completedFuture(body);
        }
        if (body == null) {
            return CompletableFuture.failedFuture(new EmptyBodyException());
        }

        List<InjectionTag> tags = InjectionTagParser.scan(body);
        if (tags.isEmpty()) {
            return CompletableFuture.completedFuture(body);
        }

        List<CompletableFuture<RenderedPart>> parts = new ArrayList<>(tags.size());
        for (InjectionTag tag : tags) {
            Fragment template;
            try {
                template = resolveTemplate(tag);
            } catch (UnknownFragmentReferenceException | MissingTemplateSpecificationException ex) {
                log.error("Renderer: {}", ex.getMessage());
                return CompletableFuture.failedFuture(ex);
            }
            parts.add(renderTag(currentDepth, tag, template));
        }
        return FanOut.joinAll(parts).thenApply(rendered -> injectReplacements(body, rendered));
    }

    private Fragment resolveTemplate(InjectionTag tag) {
        InjectionTag.Attributes attributes = tag.attributes();
        logTag(attributes);
        if (attributes.fragmentName() != null) {
            if (!manager.hasFragment(attributes.fragmentName())) {
                throw new UnknownFragmentReferenceException(attributes.fragmentName());
            }
            return manager.fragment(attributes.fragmentName());
        }
        if (attributes.template()) {
            return Fragment.inline(tag.embeddedTemplate(), attributes.required());
        }
        throw new MissingTemplateSpecificationException(tag.rawAttributes());
    }

    private CompletableFuture<RenderedPart> renderTag(int currentDepth, InjectionTag tag, Fragment template) {
        InjectionTag.Attributes attributes = tag.attributes();
        boolean required = template.isRequired() || attributes.required();
        List<String> sources = attributes.modelsDeclared() ? attributes.models() : template.requiredData();
        return manager.fetchFragmentBody(template)
            .thenCompose(content -> renderFragment(
                currentDepth, template, content, required, sources, attributes.repeatPath()))
            .thenApply(text -> new RenderedPart(tag.start(), tag.end(), text));
    }

    private CompletableFuture<String> renderFragment(int currentDepth,
                                                     Fragment fragment,
                                                     Object content,
                                                     boolean required,
                                                     List<String> sources,
                                                     String repeatPath) {
        String repeatRoot = repeatPath == null ? null : PropertyPaths.root(repeatPath);
        if (repeatRoot != null && (!manager.hasFragment(repeatRoot) || !sources.contains(repeatRoot))) {
            InvalidRepeatSourceException error = new InvalidRepeatSourceException(repeatPath);
            log.error("Renderer: {}", error.getMessage());
            return CompletableFuture.failedFuture(error);
        }
        for (String name : sources) {
            if (!manager.hasFragment(name)) {
                MissingDataSourceException error = new MissingDataSourceException(name);
                log.error("Renderer: {}", error.getMessage());
                return CompletableFuture.failedFuture(error);
            }
        }

        List<CompletableFuture<SourceResult>> pending = new ArrayList<>(sources.size());
        for (String name : sources) {
            if (name.equals(repeatRoot)) {
                pending.add(manager.fragmentBody(name, FetchOptions.failFast())
                    .handle((body, error) -> error == null
                        ? SourceResult.loaded(name, body)
                        : SourceResult.failed(name, FanOut.unwrap(error))));
            } else {
                pending.add(manager.fragmentBody(name).thenApply(body -> SourceResult.loaded(name, body)));
            }
        }

        return FanOut.joinAll(pending)
            .<List<PartOutcome>>thenCompose(results -> {
                Map<String, Object> data = new LinkedHashMap<>();
                Throwable repeatSourceFailure = null;
                for (SourceResult result : results) {
                    if (result.failure() != null) {
                        repeatSourceFailure = result.failure();
                    }
                    data.put(result.name(), result.body());
                }
                if (repeatPath == null) {
                    return renderFragmentPart(currentDepth, content, data).thenApply(outcome -> List.of(outcome));
                }
                if (repeatSourceFailure != null) {
                    log.warn("Repeat source {} could not be fetched: {}", repeatRoot, repeatSourceFailure.getMessage());
                    Object missing = manager.fragment(repeatRoot).contentMissingMessage(repeatSourceFailure).body();
                    return CompletableFuture.completedFuture(List.of(missingContentOutcome(missing)));
                }
                return renderRepeated(currentDepth, content, data, repeatPath);
            })
            .thenCompose(outcomes -> applyErrorPolicy(fragment, required, outcomes));
    }

    private CompletableFuture<List<PartOutcome>> renderRepeated(int currentDepth,
                                                                Object content,
                                                                Map<String, Object> data,
                                                                String repeatPath) {
        List<Object> items = PropertyPaths.sequence(PropertyPaths.get(data, repeatPath));
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<CompletableFuture<PartOutcome>> renders = new ArrayList<>(items.size());
        for (Object item : items) {
            Map<String, Object> itemData = new LinkedHashMap<>();
            itemData.put(CURRENT, item);
            itemData.putAll(data);
            renders.add(renderFragmentPart(currentDepth, content, itemData));
        }
        return FanOut.joinAll(renders);
    }

    /**
     * Text for a repeat whose source could not be fetched. Structured messages are written as JSON.
     */
    private static PartOutcome missingContentOutcome(Object missing) {
        if (missing == null || missing instanceof CharSequence) {
            return PartOutcome.rendered(missing == null ? "" : missing.toString());
        }
        try {
            return PartOutcome.rendered(JSON.writeValueAsString(missing));
        } catch (JsonProcessingException ex) {
            log.error("Content missing message could not be serialised: {}", ex.getMessage());
            return PartOutcome.failed(new FragmentRenderException(ex));
        }
    }

    private CompletableFuture<String> applyErrorPolicy(Fragment fragment, boolean required, List<PartOutcome> outcomes) {
        for (PartOutcome outcome : outcomes) {
            if (outcome.failure() == null) {
                continue;
            }
            if (required) {
                return CompletableFuture.failedFuture(outcome.failure());
            }
            log.error("A non required fragment failed to render: {}", outcome.failure().getMessage());
            return CompletableFuture.completedFuture(fragment.renderErrorMessage(outcome.failure()));
        }
        return CompletableFuture.completedFuture(outcomes.stream()
            .map(PartOutcome::text)
            .collect(Collectors.joining()));
    }

    /**
     * Expands nested markers one level deeper, then evaluates the result as a template. Failures of
     * this fragment are returned as values so the caller can apply its required policy; failures
     * raised by nested fragments are already fatal and complete the future exceptionally.
     */
    private CompletableFuture<PartOutcome> renderFragmentPart(int currentDepth, Object content, Map<String, Object> data) {
        if (!(content instanceof CharSequence)) {
            Throwable cause = content == null
                ? new EmptyBodyException()
                : new IllegalArgumentException("Template body of type " + content.getClass().getName() + " is not text");
            log.error("Template rendering failed with error {}", cause.getMessage());
            return CompletableFuture.completedFuture(PartOutcome.failed(new FragmentRenderException(cause)));
        }
        return renderRecursive(content.toString(), currentDepth + 1)
            .thenApply(expanded -> evaluate(expanded, data));
    }

    private PartOutcome evaluate(String template, Map<String, Object> data) {
        Map<String, Object> model = new LinkedHashMap<>(data);
        Map<String, Object> context = new HashMap<>(model);
        context.put(MODEL, model);
        try {
            return PartOutcome.rendered(templateRenderer.render(template, context));
        } catch (RuntimeException ex) {
            log.error("Template rendering failed with error {}", ex.getMessage(), ex);
            return PartOutcome.failed(new FragmentRenderException(ex));
        }
    }

    /**
     * Rebuilds the text: untouched source between markers, each replacement in offset order, then the tail.
     */
    static String injectReplacements(String sourceText, List<RenderedPart> parts) {
        StringBuilder out = new StringBuilder(sourceText.length());
        int previousEnd = 0;
        List<RenderedPart> ordered = new ArrayList<>(parts);
        ordered.sort((a, b) -> Integer.compare(a.start(), b.start()));
        for (RenderedPart part : ordered) {
            out.append(sourceText, previousEnd, part.start()).append(part.text());
            previousEnd = part.end();
        }
        return out.append(sourceText.substring(previousEnd)).toString();
    }

    private static void logTag(InjectionTag.Attributes attributes) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("> Rendering {} template with required sources: {}",
            attributes.template() && attributes.fragmentName() == null ? "embedded" : "fetched",
            attributes.models());
        if (attributes.fragmentName() != null) {
            log.debug("> Name of template to inject: {}", attributes.fragmentName());
        }
        if (attributes.repeatPath() != null) {
            log.debug("> Iterate over data with name: {}", attributes.repeatPath());
        }
    }

    record RenderedPart(int start, int end, String text) {
    }

    private record SourceResult(String name, Object body, Throwable failure) {

        static SourceResult loaded(String name, Object body) {
            return new SourceResult(name, body, null);
        }

        static SourceResult failed(String name, Throwable failure) {
            return new SourceResult(name, null, failure);
        }
    }

    private record PartOutcome(String text, FragmentRenderException failure) {

        static PartOutcome rendered(String text) {
            return new PartOutcome(text, null);
        }

        static PartOutcome failed(FragmentRenderException failure) {
            return new PartOutcome(null, failure);
        }
    }
}
