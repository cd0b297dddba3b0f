package ca.jonathanfritz.bankcat.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.beryx.textio.TextIO;
import org.beryx.textio.TextIoFactory;

/**
 * Guice module for console output. Reports and help text share a single terminal.
 */
public class CLIModule extends AbstractModule {

    @Provides
    @Singleton
    TextIO provideTextIO() {
        return TextIoFactory.getTextIO();
    }

    @Provides
    @Singleton
    CLI provideCLI(TextIO textIO) {
        return new CLI(textIO);
    }
}
