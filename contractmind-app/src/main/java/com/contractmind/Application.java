package com.contractmind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ContractMind 应用启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到 domain / infrastructure / trigger 各模块中的组件。
 * </p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
