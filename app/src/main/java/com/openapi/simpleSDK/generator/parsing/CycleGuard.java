package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-entrancy and recursion depth detection around every schema resolution.
 *
 * Only named registry schemas are tracked on the recursion stack. The depth counter applies to
 * every node, named or anonymous, so deeply nested inline structures are bounded as well.
 */
public class CycleGuard {
    private static final Logger logger = LoggerFactory.getLogger(CycleGuard.class);

    private final ParsingContext context;

    public CycleGuard(ParsingContext context) {
        this.context = context;
    }

    /**
     * Enters a node. On {@link GuardResult.Outcome#ENTERED} the caller must later call
     * {@link #exit(String, boolean)} with the same arguments.
     *
     * @param name the registry name, or null for anonymous nodes
     * @param tracked true if {@code name} is a registry name that belongs on the recursion stack
     */
    public GuardResult enter(String name, boolean tracked) {
        boolean onStack = tracked && name != null;
        if (onStack && context.isInRecursionStack(name)) {
            ParsingContext.CycleCheck check = context.enterSchema(name);
            return GuardResult.cycleHit(cyclePlaceholder(name, check.path()), check.path());
        }

        int depth = context.enterDepth();
        if (depth > context.getOptions().maxDepth()) {
            context.exitDepth();
            IRSchema placeholder = depthPlaceholder(name, onStack);
            return GuardResult.depthExceeded(placeholder, placeholder.getCircularRefPath());
        }

        if (onStack) {
            context.enterSchema(name);
        }
        return GuardResult.entered();
    }

    public void exit(String name, boolean tracked) {
        if (tracked && name != null) {
            context.exitSchema(name);
        }
        context.exitDepth();
    }

    /**
     * The canonical instance of a name on the stack was registered when the name was entered.
     * It is flagged circular and returned, so every referrer shares one object.
     */
    private IRSchema cyclePlaceholder(String name, String path) {
        IRSchema canonical = context.getSchema(name);
        if (canonical == null) {
            canonical = new IRSchema(name);
            context.registerSchema(name, canonical);
        }
        canonical.setCircularRef(true);
        if (canonical.getCircularRefPath() == null) {
            canonical.setCircularRefPath(path);
        }

        if (context.getOptions().debugCycles()) {
            logger.info("Cycle detected: {} (parsing path: {})", path, context.currentPath());
        } else {
            logger.debug("Cycle detected: {}", path);
        }
        context.addWarning(ParseWarning.Kind.CYCLE_DETECTED, "Circular reference detected: " + path);
        context.recordCycle(path);
        return canonical;
    }

    private IRSchema depthPlaceholder(String name, boolean register) {
        int maxDepth = context.getOptions().maxDepth();
        String label = name == null ? "<anonymous>" : name;
        String path = label + " -> MAX_DEPTH_EXCEEDED";

        IRSchema placeholder = new IRSchema(register ? name : null, "object");
        placeholder.setCircularRef(true);
        placeholder.setCircularRefPath(path);
        placeholder.setMaxDepthExceeded(true);
        placeholder.setFromUnresolvedRef(true);
        placeholder.setDescription(String.format(
            "[Maximum recursion depth (%d) exceeded for '%s']", maxDepth, label));

        if (register && !context.hasSchema(name)) {
            context.registerSchema(name, placeholder);
        }
        context.addWarning(ParseWarning.Kind.MAX_DEPTH_EXCEEDED, String.format(
            "Maximum recursion depth (%d) exceeded at '%s' (path: %s)", maxDepth, label, context.currentPath()));
        return placeholder;
    }
}
