package com.support.triage.spring_server.repository;

import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface IssueRepository extends MongoRepository<Issue, String> {

    List<Issue> findByCustomerIdOrderByCreatedAtDesc(String customerId);

    List<Issue> findByCustomerIdAndStatusIn(String customerId, Collection<IssueStatus> statuses);

    List<Issue> findByCreatedAtGreaterThanEqual(LocalDateTime since);
}
