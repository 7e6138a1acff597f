package ir.ipaam.layoutservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LayoutServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LayoutServiceApplication.class, args);
    }
}
