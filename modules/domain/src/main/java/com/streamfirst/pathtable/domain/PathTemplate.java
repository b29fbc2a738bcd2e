package com.streamfirst.pathtable.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled path template such as {@code /data/{country}/{company}/{year:int}_revenue.json}.
 *
 * <p>A template is a sequence of literal segments and {@code {name[:type]}} placeholders.
 * Literal braces are written doubled. Placeholder names are identifiers,
 * unique within the template; the type is {@code string} (default), {@code integer} or
 * {@code float}. Compiled templates are immutable and thread-safe.
 */
public final class PathTemplate {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String source;
    private final List<Segment> segments;
    private final Map<String, Placeholder> placeholders;
    private final Pattern pattern;

    private PathTemplate(String source, List<Segment> segments, Map<String, Placeholder> placeholders) {
        this.source = source;
        this.segments = List.copyOf(segments);
        this.placeholders = Collections.unmodifiableMap(placeholders);

        StringBuilder regex = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isLiteral()) {
                regex.append(Pattern.quote(segment.literal()));
            } else {
                regex.append('(').append(segment.placeholder().type().regex()).append(')');
            }
        }
        this.pattern = Pattern.compile(regex.toString());
    }

    /**
     * Compiles a template.
     *
     * @throws TemplateException on unbalanced braces, an invalid or repeated placeholder
     *                           name, or an unknown type annotation
     */
    public static PathTemplate compile(String template) {
        if (template == null || template.isEmpty()) {
            throw new TemplateException(String.valueOf(template), "template cannot be empty");
        }

        List<Segment> segments = new ArrayList<>();
        Map<String, Placeholder> placeholders = new LinkedHashMap<>();
        StringBuilder literal = new StringBuilder();

        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new TemplateException(template, "unclosed '{' at index " + i);
                }
                String body = template.substring(i + 1, close);
                if (body.indexOf('{') >= 0) {
                    throw new TemplateException(template, "nested '{' in placeholder at index " + i);
                }
                Placeholder placeholder = parsePlaceholder(template, body);
                if (placeholders.containsKey(placeholder.name())) {
                    throw new TemplateException(template, "placeholder '" + placeholder.name() + "' is repeated");
                }
                if (literal.length() > 0) {
                    segments.add(Segment.literal(literal.toString()));
                    literal.setLength(0);
                }
                placeholders.put(placeholder.name(), placeholder);
                segments.add(Segment.placeholder(placeholder));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new TemplateException(template, "unmatched '}' at index " + i);
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            segments.add(Segment.literal(literal.toString()));
        }
        return new PathTemplate(template, segments, placeholders);
    }

    private static Placeholder parsePlaceholder(String template, String body) {
        int colon = body.indexOf(':');
        String name = colon < 0 ? body : body.substring(0, colon);
        String annotation = colon < 0 ? "" : body.substring(colon + 1);
        if (name.isEmpty()) {
            throw new TemplateException(template, "placeholder without a name");
        }
        if (!NAME.matcher(name).matches()) {
            throw new TemplateException(template, "invalid placeholder name '" + name + "'");
        }
        PlaceholderType type = PlaceholderType.fromAnnotation(annotation)
            .orElseThrow(() -> new TemplateException(template,
                "unknown type '" + annotation + "' for placeholder '" + name + "'"));
        return new Placeholder(name, type);
    }

    /**
     * Matches a whole path against this template.
     *
     * @return the extracted binding, or empty if the path does not conform
     */
    public Optional<KeyBinding> match(String path) {
        Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        KeyBinding.Builder binding = KeyBinding.builder();
        int group = 1;
        for (Placeholder placeholder : placeholders.values()) {
            Optional<Object> value = placeholder.type().parse(matcher.group(group++));
            if (value.isEmpty()) {
                return Optional.empty();
            }
            binding.put(placeholder.name(), value.get());
        }
        return Optional.of(binding.build());
    }

    /**
     * Renders the concrete path for a full binding. Entries not named by the template are ignored.
     *
     * @throws MissingKeyException   if a placeholder is not bound
     * @throws TypeMismatchException if a value does not fit its placeholder type
     */
    public String build(KeyBinding binding) {
        StringBuilder path = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isLiteral()) {
                path.append(segment.literal());
                continue;
            }
            Placeholder placeholder = segment.placeholder();
            if (!binding.contains(placeholder.name())) {
                throw new MissingKeyException(source, placeholder.name());
            }
            Object value = placeholder.type().normalize(placeholder.name(), binding.get(placeholder.name()));
            path.append(placeholder.type().format(value));
        }
        return path.toString();
    }

    /**
     * Longest literal prefix before the first placeholder.
     */
    public String globPrefix() {
        if (segments.isEmpty() || !segments.get(0).isLiteral()) {
            return "";
        }
        return segments.get(0).literal();
    }

    /**
     * The glob prefix extended through the leading string placeholders bound in
     * {@code constraints}, so that listing can start deeper in the tree. Numeric placeholders
     * stop the extension since several spellings parse to the same value.
     */
    public String listingPrefix(KeyBinding constraints) {
        StringBuilder prefix = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isLiteral()) {
                prefix.append(segment.literal());
                continue;
            }
            Placeholder placeholder = segment.placeholder();
            if (placeholder.type() != PlaceholderType.STRING || !constraints.contains(placeholder.name())) {
                break;
            }
            prefix.append(placeholder.type().format(
                placeholder.type().normalize(placeholder.name(), constraints.get(placeholder.name()))));
        }
        return prefix.toString();
    }

    /**
     * Directory part of {@link #globPrefix()}: everything up to and excluding its last '/'.
     */
    public String rootDirectory() {
        String prefix = globPrefix();
        int slash = prefix.lastIndexOf('/');
        return slash < 0 ? "" : prefix.substring(0, slash);
    }

    public Set<String> placeholderNames() {
        return placeholders.keySet();
    }

    public List<Placeholder> placeholders() {
        return List.copyOf(placeholders.values());
    }

    public Optional<Placeholder> placeholder(String name) {
        return Optional.ofNullable(placeholders.get(name));
    }

    /**
     * Validates and normalizes a value for the named placeholder.
     *
     * @throws IllegalArgumentException if the template has no such placeholder
     * @throws TypeMismatchException    if the value does not fit the placeholder type
     */
    public Object checkValue(String name, Object value) {
        Placeholder placeholder = placeholders.get(name);
        if (placeholder == null) {
            throw new IllegalArgumentException("Template '" + source + "' has no placeholder '" + name + "'");
        }
        return placeholder.type().normalize(name, value);
    }

    public String source() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathTemplate other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }

    private record Segment(String literal, Placeholder placeholder) {
        static Segment literal(String text) {
            return new Segment(text, null);
        }

        static Segment placeholder(Placeholder placeholder) {
            return new Segment(null, placeholder);
        }

        boolean isLiteral() {
            return placeholder == null;
        }
    }
}
