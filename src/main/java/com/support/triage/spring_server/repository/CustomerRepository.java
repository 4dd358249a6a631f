package com.support.triage.spring_server.repository;

import com.support.triage.spring_server.entity.Customer;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface CustomerRepository extends MongoRepository<Customer, String> {

    boolean existsByEmail(String email);
}
