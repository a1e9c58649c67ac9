package ai.storefront.translator.cli;

import ai.storefront.translator.engine.TranslationEngine;
import java.io.PrintWriter;

/**
 * A subcommand that runs against a fully wired engine and returns the process exit code.
 */
interface EngineCommand {

    int execute(TranslationEngine engine, PrintWriter out);
}
