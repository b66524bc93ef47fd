package io.github.whento;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("io.github.whento.infrastructure.mapper")
public class WhentoApplication {

	public static void main(String[] args) {
		SpringApplication.run(WhentoApplication.class, args);
	}

}
