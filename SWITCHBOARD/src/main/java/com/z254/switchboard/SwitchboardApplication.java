package com.z254.switchboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SWITCHBOARD - coordination core for remote conversational agents.
 *
 * <p>SWITCHBOARD provides:
 * <ul>
 *   <li>Agent Registry - capability and intent based routing over configured agents</li>
 *   <li>Coordinator - sequential, parallel and conditional workflows with task dependencies</li>
 *   <li>Circuit Breakers - per-endpoint admission control with recovery probing</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class SwitchboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwitchboardApplication.class, args);
    }
}
