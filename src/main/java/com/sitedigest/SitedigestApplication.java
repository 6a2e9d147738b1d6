package com.sitedigest;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class SitedigestApplication {

    static final String SERVE = "serve";

    public static void main(String[] args) {
        // Container platforms start the jar without arguments.
        if (args.length == 0 && System.getenv("SITEDIGEST_SERVE") != null) {
            args = new String[]{SERVE};
        }
        boolean serve = isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(SitedigestApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .properties("spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /**
     * True when the first positional argument is the {@code serve} subcommand.
     * Options before it (e.g. {@code --spring.profiles.active=x}) are skipped.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (arg.startsWith("-")) {
                continue;
            }
            return SERVE.equals(arg);
        }
        return false;
    }
}
