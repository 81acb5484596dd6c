package com.supperclub.reservation;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@OpenAPIDefinition(info = @Info(
        title = "Reservation Service API",
        description = "Table holds, bookings, admin modifications and payment reconciliation",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = {"com.supperclub.reservation", "com.supperclub.common"})
@EnableScheduling
public class ReservationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
