package com.perizia;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author perizia
 * @since 2025-03-02
 */
@SpringBootApplication
@MapperScan("com.perizia.mapper")
public class PeriziaApplication {

	public static void main(String[] args) {
		SpringApplication.run(PeriziaApplication.class, args);
	}

}
