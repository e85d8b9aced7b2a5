package io.statusmvp.tokenbalances.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs detached work (cache write-backs, image re-hosting) that the response never waits for.
 * Failures are logged here since no caller observes them.
 */
@Component
public class BackgroundTasks {
  private static final Logger log = LoggerFactory.getLogger(BackgroundTasks.class);

  private final Scheduler scheduler;

  @Autowired
  public BackgroundTasks() {
    this(Schedulers.boundedElastic());
  }

  public BackgroundTasks(Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  public void submit(String description, Runnable task) {
    Mono.fromRunnable(task)
        .subscribeOn(scheduler)
        .subscribe(
            ignored -> {},
            e -> log.warn("background task failed: {}", description, e),
            () -> log.debug("background task done: {}", description));
  }
}
