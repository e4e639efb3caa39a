package com.dynamoexpr.eval;

import com.dynamoexpr.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of OperandResolver.
 * <p>
 * Unknown placeholders are errors, as in DynamoDB; a path that does not exist in the item
 * resolves to empty.
 */
public class DefaultOperandResolver implements OperandResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultOperandResolver.class);

    @Override
    public Optional<Object> resolve(String reference, ItemContext context) {
        if (reference == null || reference.isEmpty() || context == null) {
            return Optional.empty();
        }

        OperandSource source = OperandSource.fromReference(reference);
        return switch (source) {
            case STRING_LITERAL -> Optional.of(unquote(reference));
            case NUMBER_LITERAL -> Optional.of(new BigDecimal(reference));
            case VALUE_PLACEHOLDER -> Optional.of(context.getAttributeValue(reference)
                    .orElseThrow(() -> new EvaluationException(
                            "Value placeholder " + reference + " is not defined")));
            case ATTRIBUTE_PATH -> resolvePath(reference, context);
        };
    }

    private Optional<Object> resolvePath(String path, ItemContext context) {
        Object current = null;
        boolean first = true;

        for (String segment : path.split("\\.", -1)) {
            int bracket = segment.indexOf('[');
            String name = bracket < 0 ? segment : segment.substring(0, bracket);
            if (name.isEmpty()) {
                throw new EvaluationException("Invalid document path: " + path);
            }
            if (OperandSource.isNamePlaceholder(name)) {
                name = substitute(name, context);
            }

            Optional<Object> next = first ? context.getAttribute(name) : member(current, name);
            first = false;
            if (next.isEmpty()) {
                log.debug("Path {} not found at segment {}", path, name);
                return Optional.empty();
            }
            current = next.get();

            if (bracket >= 0) {
                Optional<Object> indexed = index(current, segment.substring(bracket), path);
                if (indexed.isEmpty()) {
                    return Optional.empty();
                }
                current = indexed.get();
            }
        }
        return Optional.of(current);
    }

    private String substitute(String placeholder, ItemContext context) {
        return context.getAttributeName(placeholder)
                .orElseThrow(() -> new EvaluationException(
                        "Name placeholder " + placeholder + " is not defined"));
    }

    private Optional<Object> member(Object container, String name) {
        if (container instanceof Map<?, ?> map) {
            return Optional.ofNullable(map.get(name));
        }
        return Optional.empty();
    }

    private Optional<Object> index(Object value, String indexes, String path) {
        Object current = value;
        int pos = 0;
        while (pos < indexes.length()) {
            int close = indexes.indexOf(']', pos);
            if (indexes.charAt(pos) != '[' || close < 0) {
                throw new EvaluationException("Invalid list index in document path: " + path);
            }
            int index;
            try {
                index = Integer.parseInt(indexes.substring(pos + 1, close));
            } catch (NumberFormatException e) {
                throw new EvaluationException("Invalid list index in document path: " + path);
            }
            if (!(current instanceof List<?> list) || index < 0 || index >= list.size()) {
                return Optional.empty();
            }
            current = list.get(index);
            pos = close + 1;
        }
        return Optional.of(current);
    }

    private static String unquote(String literal) {
        StringBuilder sb = new StringBuilder(literal.length());
        for (int i = 1; i < literal.length() - 1; i++) {
            char c = literal.charAt(i);
            if (c == '\\' && i + 1 < literal.length() - 1) {
                char escaped = literal.charAt(++i);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
