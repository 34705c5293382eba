package org.arena;

import org.arena.config.ArenaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ArenaProperties.class)
public class ArenaApiFreeApplication {

    public static void main(String[] args) {
        // DEBUG 环境变量打开业务日志的 debug 级别
        if (System.getenv("DEBUG") != null && System.getProperty("logging.level.org.arena") == null) {
            System.setProperty("logging.level.org.arena", "DEBUG");
        }
        SpringApplication.run(ArenaApiFreeApplication.class, args);
        System.out.println("(♥◠‿◠)ﾉﾞ  Arena-Api-Free启动成功   ლ(´ڡ`ლ)ﾞ");
    }

}
