package com.whereq.tempo.store;

import com.whereq.tempo.model.JobTrigger;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobTriggerRepository extends JpaRepository<JobTrigger, String> {

    List<JobTrigger> findAllByOrderByCreatedAtAsc();
}
