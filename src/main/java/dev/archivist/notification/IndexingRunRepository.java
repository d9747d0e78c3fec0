package dev.archivist.notification;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link IndexingRun} history. */
public interface IndexingRunRepository extends JpaRepository<IndexingRun, String> {}
