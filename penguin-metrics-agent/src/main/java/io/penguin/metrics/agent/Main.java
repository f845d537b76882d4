package io.penguin.metrics.agent;

import io.penguin.metrics.agent.config.LogbackConfigurator;

public class Main {

    public static void main(String[] args) {
        LogbackConfigurator.configure();
        AgentServer.main(args);
    }
}
