package tw.gc.quant.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuantEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantEngineApplication.class, args);
    }
}
