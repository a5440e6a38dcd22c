package io.b2mash.b2b.artifactvault.lifecycle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LifecycleRunSummary {

  private final Instant startedAt;
  private final boolean dryRun;
  private final List<LifecycleTransition> transitions = new ArrayList<>();
  private int scanned;
  private int eligible;
  private int promoted;
  private int purged;
  private int alreadyComplete;
  private int errors;

  public LifecycleRunSummary(Instant startedAt, boolean dryRun) {
    this.startedAt = startedAt;
    this.dryRun = dryRun;
  }

  void recordScanned() {
    scanned++;
  }

  void recordAlreadyComplete() {
    alreadyComplete++;
  }

  /** A tier or tenant directory that could not be listed; its artifacts were not scanned. */
  void recordListingError() {
    errors++;
  }

  void record(LifecycleTransition transition) {
    transitions.add(transition);
    switch (transition.state()) {
      case ELIGIBLE -> eligible++;
      case PROMOTED -> {
        eligible++;
        promoted++;
      }
      case PURGED -> {
        eligible++;
        purged++;
      }
      case SKIPPED -> {
        eligible++;
        errors++;
      }
    }
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public int getScanned() {
    return scanned;
  }

  /** Transitions found due, whether executed, previewed or failed. */
  public int getEligible() {
    return eligible;
  }

  public int getPromoted() {
    return promoted;
  }

  public int getPurged() {
    return purged;
  }

  public int getAlreadyComplete() {
    return alreadyComplete;
  }

  public int getErrors() {
    return errors;
  }

  public List<LifecycleTransition> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }
}
