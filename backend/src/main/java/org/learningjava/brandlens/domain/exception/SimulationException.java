package org.learningjava.brandlens.domain.exception;

import org.learningjava.brandlens.domain.model.Engine;

public class SimulationException extends RuntimeException {

    private final Engine engine;

    public SimulationException(Engine engine, String message) {
        super(message);
        this.engine = engine;
    }

    public SimulationException(Engine engine, String message, Throwable cause) {
        super(message, cause);
        this.engine = engine;
    }

    public Engine getEngine() {
        return engine;
    }
}
