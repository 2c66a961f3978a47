package com.aboutblank.repository;

import com.aboutblank.entity.AnonymousMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for the community board.
 */
@Repository
public interface AnonymousMessageRepository extends JpaRepository<AnonymousMessage, Long> {

    /**
     * Find the most recent messages across all authors.
     *
     * @param pageable page size caps the number of messages returned
     * @return messages ordered by creation time descending
     */
    List<AnonymousMessage> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
}
