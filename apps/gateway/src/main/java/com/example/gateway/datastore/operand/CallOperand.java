package com.example.gateway.datastore.operand;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.common.exception.TranslationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generator turning a logical operator into backend syntax.
 *
 * <p>{@code $0}, {@code $1}, ... in {@code mapping} are replaced by the argument at that index. A call
 * with one extra argument compares the generated expression to it:
 * {@code abs($0)} applied to {@code (x, 5)} yields {@code ABS(x) = 5}.
 *
 * @param op      operator name as emitted by the policy engine
 * @param args    number of arguments the mapping consumes
 * @param mapping expression template
 * @param builtin whether the operator is also registered as a policy-engine function
 */
public record CallOperand(
        @JsonProperty("op") String op,
        @JsonProperty("args") int args,
        @JsonProperty("mapping") String mapping,
        @JsonProperty("builtin") boolean builtin
) {
    static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");

    public String apply(List<String> arguments) {
        int count = arguments.size();
        if (count < args || count > args + 1) {
            throw new TranslationException(TranslationError.WRONG_ARGUMENT_COUNT, String.format(
                    "call operand [%s] expects %d or %d arguments but got %d: %s",
                    op, args, args + 1, count, arguments));
        }

        Matcher matcher = PLACEHOLDER.matcher(mapping);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(arguments.get(index)));
        }
        matcher.appendTail(sb);

        if (count > args) {
            sb.append(" = ").append(arguments.get(count - 1));
        }
        return sb.toString();
    }

    /**
     * Placeholder indices referenced by the mapping, in order of appearance.
     */
    List<Integer> placeholderIndices() {
        List<Integer> indices = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(mapping);
        while (matcher.find()) {
            indices.add(Integer.parseInt(matcher.group(1)));
        }
        return indices;
    }
}
