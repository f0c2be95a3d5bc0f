package dustin.miniauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MiniAuthApplication {

	public static void main(String[] args) {
		SpringApplication.run(MiniAuthApplication.class, args);
	}

}
