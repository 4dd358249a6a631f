package com.support.triage.spring_server.controller;

import com.support.triage.spring_server.dto.ApiResponse;
import com.support.triage.spring_server.dto.CustomerHistory;
import com.support.triage.spring_server.dto.CustomerRiskProfile;
import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.exception.TriageException;
import com.support.triage.spring_server.service.CustomerHistoryService;
import com.support.triage.spring_server.service.CustomerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/customers")
public class CustomerController {
    private static final Logger log = LoggerFactory.getLogger(CustomerController.class);

    @Autowired
    private CustomerService customerService;

    @Autowired
    private CustomerHistoryService customerHistoryService;

    @PostMapping
    public ResponseEntity<ApiResponse<Customer>> createCustomer(@RequestBody Customer request) {
        try {
            Customer created = customerService.createCustomer(request);
            return ResponseEntity.status(201).body(ApiResponse.success("Customer created", created));
        } catch (TriageException e) {
            log.warn("Customer creation rejected: {}", e.getMessage());
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error creating customer", e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to create customer"));
        }
    }

    @GetMapping("/{customerId}/history")
    public ResponseEntity<ApiResponse<CustomerHistory>> getCustomerHistory(@PathVariable String customerId) {
        try {
            return ResponseEntity.ok(ApiResponse.success("Customer history found",
                    customerHistoryService.getCustomerHistory(customerId)));
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error reading history of customer {}", customerId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to retrieve customer history"));
        }
    }

    @GetMapping("/risk-analysis")
    public ResponseEntity<ApiResponse<List<CustomerRiskProfile>>> getRiskAnalysis() {
        try {
            List<CustomerRiskProfile> profiles = customerHistoryService.getRiskAnalysis();
            return ResponseEntity.ok(ApiResponse.success("Risk analysis for " + profiles.size() + " customers", profiles));
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error computing customer risk analysis", e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to compute risk analysis"));
        }
    }
}
