package world.willfrog.storeagent;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@MapperScan({"world.willfrog.storeagent.mapper"})
public class StoreAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoreAgentApplication.class, args);
    }
}
