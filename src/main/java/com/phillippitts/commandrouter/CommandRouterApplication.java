package com.phillippitts.commandrouter;

import com.phillippitts.commandrouter.config.properties.ChannelProperties;
import com.phillippitts.commandrouter.config.properties.ClassifierProperties;
import com.phillippitts.commandrouter.config.properties.DirectoryProperties;
import com.phillippitts.commandrouter.config.properties.ExecutorProperties;
import com.phillippitts.commandrouter.config.properties.FallbackHealthProperties;
import com.phillippitts.commandrouter.config.properties.ResolverProperties;
import com.phillippitts.commandrouter.config.properties.WorkflowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ClassifierProperties.class,
        ResolverProperties.class,
        WorkflowProperties.class,
        ChannelProperties.class,
        DirectoryProperties.class,
        ExecutorProperties.class,
        FallbackHealthProperties.class
})
@EnableScheduling
public class CommandRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommandRouterApplication.class, args);
    }

}
