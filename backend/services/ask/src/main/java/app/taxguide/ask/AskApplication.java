package app.taxguide.ask;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class AskApplication {

	public static void main(String[] args) {
		SpringApplication.run(AskApplication.class, args);
	}

}
