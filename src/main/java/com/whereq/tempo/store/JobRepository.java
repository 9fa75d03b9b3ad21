package com.whereq.tempo.store;

import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobRepository extends JpaRepository<Job, String> {

    List<Job> findByUserIdOrderByCreatedAtAsc(String userId);

    List<Job> findByUserIdAndStatusOrderByCreatedAtAsc(String userId, JobStatus status);
}
