package com.support.triage.spring_server.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Document(collection = "customers")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Customer {
    @Id
    private String customerId;
    private String customerName;
    @Indexed(unique = true)
    private String email;
    private String company;
    private CustomerTier tier = CustomerTier.BASIC;
    private LocalDateTime createdAt;
}
