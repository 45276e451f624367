package dev.nuclr.spherify.service;

import java.time.Duration;
import java.util.List;

/**
 * Outcomes of one batch run, one per resolved input file, in input order.
 */
public record BatchReport(List<Outcome> outcomes, Duration elapsed) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public List<Outcome> successes() {
        return outcomes.stream().filter(Outcome::isPresent).toList();
    }

    public List<Outcome> failures() {
        return outcomes.stream().filter(o -> !o.isPresent()).toList();
    }

    /** Present images whose requested save did not happen. */
    public List<Outcome> saveFailures() {
        return outcomes.stream().filter(Outcome::saveFailed).toList();
    }

    public boolean hasSaveFailures() {
        return outcomes.stream().anyMatch(Outcome::saveFailed);
    }
}
