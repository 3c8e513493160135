package com.spreadsheet.transpiler;

import com.spreadsheet.transpiler.cli.TranspilerCommand;
import com.spreadsheet.transpiler.config.TranspilerProperties;
import com.spreadsheet.transpiler.services.ConversionService;
import com.spreadsheet.transpiler.services.DependencyTreeRenderer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import picocli.CommandLine;

/**
 * Starts the REST API when run without arguments.
 * With arguments it runs once as a command line tool (no web server) and exits
 * with the command's exit code, e.g. {@code java -jar transpiler.jar book.xlsx -c C1}.
 */
@SpringBootApplication
@EnableConfigurationProperties(TranspilerProperties.class)
public class TranspilerApplication {

    public static void main(String[] args) {
        if (args.length == 0) {
            SpringApplication.run(TranspilerApplication.class, args);
            return;
        }

        SpringApplication application = new SpringApplication(TranspilerApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setAdditionalProfiles("cli");
        application.setLogStartupInfo(false);
        ConfigurableApplicationContext context = application.run();

        TranspilerCommand command = new TranspilerCommand(
                context.getBean(ConversionService.class),
                context.getBean(DependencyTreeRenderer.class),
                context.getBean(TranspilerProperties.class).getSheetIndex());
        int exitCode = new CommandLine(command).execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
