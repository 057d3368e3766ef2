package bridge.impl;

import bridge.contracts.RulesEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

/**
 * Finds the {@link RulesEngine} to use. The first provider registered under
 * {@code META-INF/services/bridge.contracts.RulesEngine} wins; without one the
 * syntax-only {@link StructuralRulesEngine} is returned.
 */
public final class RulesEngines {
    private static final Logger LOG = LoggerFactory.getLogger(RulesEngines.class);

    private RulesEngines() {}

    public static RulesEngine load() {
        ClassLoader tccl = Thread.currentThread().getContextClassLoader();
        ServiceLoader<RulesEngine> sl = tccl != null
                ? ServiceLoader.load(RulesEngine.class, tccl)
                : ServiceLoader.load(RulesEngine.class);
        for (RulesEngine r : sl) {
            LOG.info("Using rules engine {}", r.getClass().getName());
            return r;
        }
        LOG.warn("No rules engine provider found; checking FEN syntax only, checkmate tagging disabled");
        return new StructuralRulesEngine();
    }
}
