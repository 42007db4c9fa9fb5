package me.christianrobert.ilcodegen.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.ilcodegen.codegen.GeneratedCode;
import me.christianrobert.ilcodegen.codegen.TargetBackend;
import me.christianrobert.ilcodegen.codegen.context.CodegenException;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlFormatException;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.il.IlTreeReader;
import me.christianrobert.ilcodegen.target.cpp.emitter.CppEmitter;
import me.christianrobert.ilcodegen.target.cpp.transformer.CppTransformer;
import me.christianrobert.ilcodegen.target.delphi.emitter.DelphiEmitter;
import me.christianrobert.ilcodegen.target.delphi.transformer.DelphiTransformer;
import me.christianrobert.ilcodegen.util.IlTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * High-level service for generating target source code from an IL document.
 * This is the main entry point of the backend.
 *
 * <p>Architecture:
 * <pre>
 * IL JSON → IlTreeReader → Transformer → Target AST → Emitter → source text
 *                ↓              ↓                         ↓
 *             IlNode     CppCompilationUnit          String
 *                         / DelphiUnit
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * GenerationResult result = service.generate(ilJson, "delphi", Map.of("unitName", "Ciphers"));
 * if (result.isSuccess()) {
 *     String unit = result.getCode();
 *     // result.getWarnings() lists the constructs that were dropped or approximated
 * } else {
 *     // Handle error: result.getErrorMessage()
 * }
 * </pre>
 *
 * <p>Unsupported constructs are never failures: they end up as warnings on a successful
 * result. A run fails only for an unknown target or a structurally invalid document.</p>
 */
@ApplicationScoped
public class CodeGenerationService {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationService.class);

    @Inject
    IlTreeReader reader;

    private final Map<String, TargetBackend<?>> backends = new LinkedHashMap<>();

    public CodeGenerationService() {
        register(new TargetBackend<>(new CppTransformer(), new CppEmitter()));
        register(new TargetBackend<>(new DelphiTransformer(), new DelphiEmitter()));
    }

    private void register(TargetBackend<?> backend) {
        backends.put(backend.getTargetId(), backend);
    }

    /**
     * Target identifiers this service can generate, in registration order.
     */
    public Set<String> getSupportedTargets() {
        return Collections.unmodifiableSet(backends.keySet());
    }

    public boolean supportsTarget(String targetId) {
        return targetId != null && backends.containsKey(targetId);
    }

    /**
     * Generates source code from an IL JSON document.
     *
     * @param ilJson IL document text
     * @param targetId target identifier ({@code cpp} or {@code delphi})
     * @param options user options, may be null; unknown keys are ignored
     * @return GenerationResult containing either the emitted text or error details
     */
    public GenerationResult generate(String ilJson, String targetId, Map<String, ?> options) {
        return generate(ilJson, targetId, options, false);
    }

    /**
     * Same as {@link #generate(String, String, Map)}, optionally with the IL tree dump for
     * debugging.
     */
    public GenerationResult generate(String ilJson, String targetId, Map<String, ?> options, boolean includeIlTree) {
        if (!supportsTarget(targetId)) {
            return GenerationResult.failure(targetId, "Unsupported target: " + targetId);
        }

        IlNode program;
        try {
            // STEP 1: Read and validate the IL document
            log.debug("Step 1: Reading IL document");
            program = reader.read(ilJson);
        } catch (IlFormatException e) {
            log.warn("Invalid IL document: {}", e.getDetailedMessage());
            return GenerationResult.failure(targetId, e.getDetailedMessage());
        }

        return generate(program, targetId, options, includeIlTree);
    }

    /**
     * Generates source code from an IL tree that was read or built already.
     */
    public GenerationResult generate(IlNode program, String targetId, Map<String, ?> options) {
        return generate(program, targetId, options, false);
    }

    private GenerationResult generate(IlNode program, String targetId, Map<String, ?> options,
                                      boolean includeIlTree) {
        TargetBackend<?> backend = backends.get(targetId);
        if (backend == null) {
            return GenerationResult.failure(targetId, "Unsupported target: " + targetId);
        }
        if (program == null) {
            return GenerationResult.failure(targetId, "IL tree cannot be null");
        }

        String ilTree = null;
        if (includeIlTree) {
            log.debug("Generating IL tree representation");
            ilTree = IlTreeFormatter.format(program);
        }

        try {
            // STEP 2: Resolve options
            CodegenOptions codegenOptions = CodegenOptions.forTarget(targetId, options);

            // STEP 3: Transform and emit
            log.debug("Step 3: Generating {} code", targetId);
            GeneratedCode generated = backend.generate(program, codegenOptions);

            if (!generated.getWarnings().isEmpty()) {
                log.warn("Generated {} code with {} warnings", targetId, generated.getWarnings().size());
            } else {
                log.info("Successfully generated {} code", targetId);
            }
            log.trace("Generated code: {}", generated.getText());
            return GenerationResult.successWithIlTree(targetId, generated, ilTree);

        } catch (CodegenException e) {
            log.error("Generation failed: {}", e.getDetailedMessage(), e);
            return GenerationResult.failure(targetId, e);

        } catch (RuntimeException e) {
            log.error("Unexpected error during generation", e);
            return GenerationResult.failure(targetId, "Unexpected error: " + e.getMessage());
        }
    }
}
