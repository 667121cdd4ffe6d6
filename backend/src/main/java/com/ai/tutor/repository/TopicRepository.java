package com.ai.tutor.repository;

import com.ai.tutor.model.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for Topic entities.
 */
@Repository
public interface TopicRepository extends JpaRepository<Topic, Long> {

    List<Topic> findBySourceIdOrderByOrderIndexAsc(Long sourceId);
}
