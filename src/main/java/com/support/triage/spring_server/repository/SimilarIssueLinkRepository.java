package com.support.triage.spring_server.repository;

import com.support.triage.spring_server.entity.SimilarIssueLink;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SimilarIssueLinkRepository extends MongoRepository<SimilarIssueLink, String> {
}
