package com.example.gateway.datastore.operand;

import com.example.gateway.common.exception.ConfigurationException;
import com.example.gateway.datastore.DatastoreType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Loads call operands per datastore type from YAML.
 *
 * <p>Defaults ship on the classpath under {@code call-operands/<type>.yml}. When an override directory
 * is configured, {@code <dir>/<type>.yml} is read on top of them: entries with the same {@code op}
 * replace the default, new entries are added. An override file that is missing or invalid is logged
 * and ignored.
 *
 * <p>Operators flagged {@code builtin} are shared with the policy engine and must keep one arity
 * across all datastore types.
 */
@Slf4j
public class CallOperandLoader {

    static final String DEFAULTS_LOCATION = "call-operands/";
    private static final String FILE_EXTENSION = ".yml";

    private final ObjectMapper yamlMapper;

    public CallOperandLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    CallOperandLoader(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    @NonNull
    public Map<DatastoreType, CallOperandRegistry> loadAll(
            @NonNull Collection<DatastoreType> types,
            @Nullable String overrideDir) {

        Map<String, Integer> builtinArity = new HashMap<>();
        Map<DatastoreType, CallOperandRegistry> registries = new EnumMap<>(DatastoreType.class);

        for (DatastoreType type : new LinkedHashSet<>(types)) {
            Map<String, CallOperand> operands = new LinkedHashMap<>();
            for (CallOperand operand : loadDefaults(type)) {
                registerBuiltin(operand, builtinArity);
                operands.put(operand.op(), operand);
            }

            if (overrideDir != null && !overrideDir.isBlank()) {
                applyOverrides(type, Path.of(overrideDir), operands, builtinArity);
            }

            registries.put(type, new CallOperandRegistry(type, operands));
            log.info("Loaded {} call operands for datastore type [{}]", operands.size(), type.key());
        }
        return registries;
    }

    private List<CallOperand> loadDefaults(DatastoreType type) {
        String location = DEFAULTS_LOCATION + type.key() + FILE_EXTENSION;
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream, location);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to load default call operands from " + location, e);
        }
    }

    private void applyOverrides(
            DatastoreType type,
            Path directory,
            Map<String, CallOperand> operands,
            Map<String, Integer> builtinArity) {

        Path file = directory.resolve(type.key() + FILE_EXTENSION);
        if (!Files.isRegularFile(file)) {
            log.warn("No custom call operands found at {}, only defaults are used for [{}]", file, type.key());
            return;
        }

        List<CallOperand> overrides;
        Map<String, Integer> arity = new HashMap<>(builtinArity);
        try (InputStream inputStream = Files.newInputStream(file)) {
            overrides = parse(inputStream, file.toString());
            overrides.forEach(operand -> registerBuiltin(operand, arity));
        } catch (IOException | ConfigurationException e) {
            log.warn("Failed loading custom call operands for [{}], only defaults are used: {}",
                    type.key(), e.getMessage());
            return;
        }

        builtinArity.putAll(arity);
        overrides.forEach(operand -> operands.put(operand.op(), operand));
        log.info("Applied {} custom call operands for [{}] from {}", overrides.size(), type.key(), file);
    }

    private List<CallOperand> parse(InputStream inputStream, String source) throws IOException {
        CallOperandFile file = yamlMapper.readValue(inputStream, CallOperandFile.class);
        if (file == null || file.callOperands() == null) {
            throw new ConfigurationException("No 'call-operands' entry in " + source);
        }
        file.callOperands().forEach(operand -> validate(operand, source));
        return file.callOperands();
    }

    private static void validate(CallOperand operand, String source) {
        if (operand.op() == null || operand.op().isBlank()) {
            throw new ConfigurationException("Call operand without 'op' in " + source);
        }
        if (operand.args() < 0) {
            throw new ConfigurationException(String.format(
                    "Call operand [%s] in %s declares negative argument count", operand.op(), source));
        }
        if (operand.mapping() == null) {
            throw new ConfigurationException(String.format(
                    "Call operand [%s] in %s has no mapping", operand.op(), source));
        }
        for (int index : operand.placeholderIndices()) {
            if (index >= operand.args()) {
                throw new ConfigurationException(String.format(
                        "Call operand [%s] in %s references $%d but only takes %d arguments",
                        operand.op(), source, index, operand.args()));
            }
        }
    }

    private static void registerBuiltin(CallOperand operand, Map<String, Integer> builtinArity) {
        if (!operand.builtin()) {
            return;
        }
        Integer registered = builtinArity.putIfAbsent(operand.op(), operand.args());
        if (registered != null && registered != operand.args()) {
            throw new ConfigurationException(String.format(
                    "Tried registering function [%s] with %d args but it was already registered with %d args",
                    operand.op(), operand.args(), registered));
        }
    }

    record CallOperandFile(@JsonProperty("call-operands") List<CallOperand> callOperands) {
    }
}
