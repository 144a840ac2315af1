package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.HAS_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;

import java.io.IOException;
import java.util.Map;
import work.forge.scaffold.config.AuthMode;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;

public final class RouterGenerators {
    private RouterGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(GenerationStep.builder("auth-router")
            .category(StepCategory.ROUTER)
            .priority(60)
            .requires("auth-service")
            .activeWhen(HAS_AUTH)
            .action(RouterGenerators::authRouter)
            .description("Generate /api/v1/auth routes")
            .build());
        registry.register(GenerationStep.builder("user-router")
            .category(StepCategory.ROUTER)
            .priority(61)
            .requires("auth-service", "core-deps")
            .activeWhen(HAS_AUTH)
            .action((config, writer) -> emit(writer, "app/routers/v1/users.py", "routers/users.py.tmpl", config))
            .description("Generate /api/v1/users routes")
            .build());
        registry.register(GenerationStep.builder("api-v1")
            .category(StepCategory.ROUTER)
            .priority(62)
            .requires("auth-router", "user-router")
            .activeWhen(HAS_AUTH)
            .action((config, writer) -> emit(writer, "app/routers/v1/__init__.py", "routers/api_v1.py.tmpl", config))
            .description("Aggregate version 1 routers")
            .build());
        return registry;
    }

    private static ActionResult authRouter(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        Map<String, String> values = baseValues(config);
        if (config.authMode() == AuthMode.COMPLETE) {
            values.put("extra_imports", "from app.schemas.token import (\n"
                + "    EmailVerificationRequest,\n"
                + "    PasswordResetConfirm,\n"
                + "    PasswordResetRequest,\n"
                + "    RefreshTokenRequest,\n"
                + ")\n"
                + "from app.utils.response import success_response\n");
            values.put("extra_routes", Templates.load("routers/auth_complete_routes.py.tmpl"));
        } else {
            values.put("extra_imports", "");
            values.put("extra_routes", "");
        }
        return emit(writer, "app/routers/v1/auth.py", "routers/auth.py.tmpl", values);
    }
}
