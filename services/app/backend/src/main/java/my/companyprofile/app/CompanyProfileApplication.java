package my.companyprofile.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CompanyProfileApplication {
	public static void main(String[] args) {
		SpringApplication.run(CompanyProfileApplication.class, args);
	}
}
