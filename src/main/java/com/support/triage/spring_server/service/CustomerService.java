package com.support.triage.spring_server.service;

import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.CustomerTier;
import com.support.triage.spring_server.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Pattern;

@Service
public class CustomerService {
    private static final Logger log = LoggerFactory.getLogger(CustomerService.class);
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final IssueStore issueStore;
    private final Clock clock;

    @Autowired
    public CustomerService(IssueStore issueStore, Clock clock) {
        this.issueStore = issueStore;
        this.clock = clock;
    }

    public Customer createCustomer(Customer request) {
        if (request == null || request.getCustomerName() == null || request.getCustomerName().isBlank()) {
            throw new InvalidInputException("customerName is required");
        }
        String email = request.getEmail() == null ? "" : request.getEmail().trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(email).matches()) {
            throw new InvalidInputException("A valid email is required");
        }
        if (issueStore.customerEmailExists(email)) {
            throw new InvalidInputException("Customer with email " + email + " already exists");
        }

        Customer customer = new Customer();
        customer.setCustomerName(request.getCustomerName().trim());
        customer.setEmail(email);
        customer.setCompany(request.getCompany());
        customer.setTier(request.getTier() == null ? CustomerTier.BASIC : request.getTier());
        customer.setCreatedAt(LocalDateTime.now(clock));
        Customer saved = issueStore.insertCustomer(customer);
        log.info("Created customer {} ({})", saved.getCustomerId(), saved.getTier());
        return saved;
    }
}
