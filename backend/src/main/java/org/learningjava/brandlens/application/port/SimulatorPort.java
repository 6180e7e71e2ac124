package org.learningjava.brandlens.application.port;

import org.learningjava.brandlens.domain.model.Engine;
import org.learningjava.brandlens.domain.model.Language;
import org.learningjava.brandlens.domain.model.Region;
import org.learningjava.brandlens.domain.model.SimulationOutput;

/**
 * Asks an answer engine the query once, the way an end user would, and reports the answer
 * together with every source it consulted. Each call is an independent sample.
 */
public interface SimulatorPort {

    /** @throws org.learningjava.brandlens.domain.exception.SimulationException when the engine call fails */
    SimulationOutput simulate(Engine engine, String query, Language language, Region region);
}
