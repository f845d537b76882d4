package io.penguin.metrics.agent.probe;

/**
 * @param comm    short process name from {@code /proc/<pid>/comm}
 * @param cmdline full command line with arguments separated by spaces; empty for kernel threads
 */
public record ProcessInfo(long pid, String comm, String cmdline) {
}
