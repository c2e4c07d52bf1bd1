package guraa.formcompare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


/**
 * Main application class for the form structure comparator
 */
@SpringBootApplication
public class FormCompareApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormCompareApplication.class, args);
    }
}
