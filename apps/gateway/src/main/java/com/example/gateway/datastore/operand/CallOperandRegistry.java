package com.example.gateway.datastore.operand;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.common.exception.TranslationException;
import com.example.gateway.datastore.DatastoreType;
import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operators available to one datastore type. Immutable once loaded, so translators may share it
 * across requests.
 */
public final class CallOperandRegistry {

    private final DatastoreType type;
    private final Map<String, CallOperand> operands;

    public CallOperandRegistry(@NonNull DatastoreType type, @NonNull Map<String, CallOperand> operands) {
        this.type = type;
        this.operands = Collections.unmodifiableMap(new LinkedHashMap<>(operands));
    }

    @NonNull
    public DatastoreType type() {
        return type;
    }

    @NonNull
    public Optional<CallOperand> lookup(@NonNull String operator) {
        return Optional.ofNullable(operands.get(operator));
    }

    /**
     * Generates backend syntax for the operator, failing when it is not registered.
     */
    @NonNull
    public String map(@NonNull String operator, @NonNull List<String> arguments) {
        CallOperand operand = lookup(operator).orElseThrow(() -> new TranslationException(
                TranslationError.UNSUPPORTED_OPERATOR, String.format(
                        "unable to find mapping for operator [%s] in call operands of datastore type [%s]",
                        operator, type.key())));
        return operand.apply(arguments);
    }

    @NonNull
    public Set<String> operators() {
        return operands.keySet();
    }

    public int size() {
        return operands.size();
    }
}
