// File: Main.java
package main;

import bridge.contracts.ConsoleHandler;
import bridge.contracts.EngineManager;
import bridge.contracts.RulesEngine;
import bridge.errors.EngineStartupException;
import bridge.impl.ConsoleHandlerImpl;
import bridge.impl.EngineManagerImpl;
import bridge.impl.RulesEngines;
import bridge.records.EngineConfig;

/**
 * Wire everything together, bring the engine up and run the console loop.
 * Configuration comes from {@code -Dengine.*} properties and {@code STOCKFISH_PATH}.
 */
public final class Main {

    public static void main(String[] args) {
        EngineConfig config = EngineConfig.fromSystem();
        RulesEngine rules = RulesEngines.load();

        try (EngineManager manager = new EngineManagerImpl(config, rules)) {
            try {
                manager.initialize();
            } catch (EngineStartupException e) {
                System.err.println("Engine failed to start: " + e.getMessage());
                System.exit(1);
            }
            System.out.println("engine-bridge ready (" + manager.status().engineName() + ")");

            ConsoleHandler console = new ConsoleHandlerImpl(manager, System.in, System.out);
            console.runLoop();
        }
    }
}
