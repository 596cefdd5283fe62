/**
 * md 命令行工具
 *
 * @date 2026/10/17
 */
package com.minidisc.cli;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MinidiscCliApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(MinidiscCliApplication.class);
        application.setBannerMode(Banner.Mode.OFF);
        System.exit(SpringApplication.exit(application.run(args)));
    }

}
