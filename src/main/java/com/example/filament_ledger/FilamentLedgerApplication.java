package com.example.filament_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilamentLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(FilamentLedgerApplication.class, args);
	}

}
