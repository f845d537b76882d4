package io.penguin.metrics.agent.probe;

/**
 * Outcome of one external command.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
