package com.support.triage.spring_server.repository;

import com.support.triage.spring_server.entity.IssueResolution;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface IssueResolutionRepository extends MongoRepository<IssueResolution, String> {

    List<IssueResolution> findByCustomerId(String customerId);
}
