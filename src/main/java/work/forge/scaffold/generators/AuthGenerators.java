package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.COMPLETE_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.HAS_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.REFRESH_TOKENS;
import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import work.forge.scaffold.config.AuthMode;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.OrmKind;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.ActivationPredicate;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepAction;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Security primitives, user and token persistence, and the auth and email services.
 */
public final class AuthGenerators {
    private AuthGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(step("security", 40, HAS_AUTH, AuthGenerators::security, "config-jwt", "database-dependencies")
            .description("Generate password hashing and JWT helpers")
            .build());
        registry.register(step("core-deps", 41, HAS_AUTH,
                (config, writer) -> emit(writer, "app/core/deps.py", "auth/deps.py.tmpl", config), "security")
            .description("Generate current-user dependencies")
            .build());
        registry.register(step("user-model", 42, HAS_AUTH, AuthGenerators::userModel, "database-dependencies")
            .description("Generate the User model")
            .build());
        registry.register(step("user-schema", 43, HAS_AUTH, AuthGenerators::userSchema)
            .description("Generate user request and response schemas")
            .build());
        registry.register(step("user-crud", 44, HAS_AUTH,
                (config, writer) -> emit(writer, "app/crud/user.py", "auth/user_crud.py.tmpl", config),
                "user-model", "user-schema")
            .description("Generate user data access")
            .build());
        registry.register(step("token-model", 45, COMPLETE_AUTH, AuthGenerators::tokenModel, "user-model")
            .description("Generate the verification and reset token model")
            .build());
        registry.register(step("token-schema", 46, COMPLETE_AUTH,
                (config, writer) -> emit(writer, "app/schemas/token.py", "auth/token_schema.py.tmpl", config),
                "user-schema")
            .description("Generate token flow schemas")
            .build());
        registry.register(step("token-crud", 47, COMPLETE_AUTH, AuthGenerators::tokenCrud, "token-model", "token-schema")
            .description("Generate token data access")
            .build());
        registry.register(step("auth-service", 48, HAS_AUTH, AuthGenerators::authService, "user-crud", "security")
            .description("Generate the authentication service")
            .build());
        registry.register(step("email-service", 49, COMPLETE_AUTH,
                (config, writer) -> emit(writer, "app/services/email.py", "auth/email_service.py.tmpl", config),
                "config-email", "auth-service")
            .description("Generate the SMTP email service")
            .build());
        registry.register(step("email-template", 50, COMPLETE_AUTH, AuthGenerators::emailTemplates, "email-service")
            .description("Generate verification and password reset email templates")
            .build());
        return registry;
    }

    private static GenerationStep.Builder step(
        String id,
        int priority,
        ActivationPredicate when,
        StepAction action,
        String... requires
    ) {
        return GenerationStep.builder(id)
            .category(StepCategory.AUTH)
            .priority(priority)
            .requires(requires)
            .activeWhen(when)
            .action(action);
    }

    private static ActionResult security(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        Map<String, String> values = baseValues(config);
        values.put("refresh_token_block", REFRESH_TOKENS.test(config) ? Templates.load("auth/security_refresh.py.tmpl") : "");
        return emit(writer, "app/core/security.py", "auth/security.py.tmpl", values);
    }

    private static ActionResult userModel(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        Optional<OrmKind> orm = config.orm();
        if (orm.isEmpty()) {
            return ActionResult.skipped("no ORM configured");
        }
        boolean sqlModel = orm.get() == OrmKind.SQLMODEL;
        Map<String, String> values = baseValues(config);
        String verification = "";
        if (config.authMode() == AuthMode.COMPLETE) {
            verification = sqlModel
                ? "    is_verified: bool = Field(default=False)\n"
                : "    is_verified: Mapped[bool] = mapped_column(Boolean, default=False)\n";
        }
        values.put("verification_field", verification);
        String template = sqlModel ? "auth/user_model_sqlmodel.py.tmpl" : "auth/user_model_sqlalchemy.py.tmpl";
        return emit(writer, "app/models/user.py", template, values);
    }

    private static ActionResult userSchema(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        Map<String, String> values = baseValues(config);
        values.put("verification_field", config.authMode() == AuthMode.COMPLETE ? "    is_verified: bool = False\n" : "");
        values.put("refresh_field", REFRESH_TOKENS.test(config) ? "    refresh_token: Optional[str] = None\n" : "");
        return emit(writer, "app/schemas/user.py", "auth/user_schema.py.tmpl", values);
    }

    private static ActionResult tokenModel(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        Optional<OrmKind> orm = config.orm();
        if (orm.isEmpty()) {
            return ActionResult.skipped("no ORM configured");
        }
        String template = orm.get() == OrmKind.SQLMODEL
            ? "auth/token_model_sqlmodel.py.tmpl"
            : "auth/token_model_sqlalchemy.py.tmpl";
        return emit(writer, "app/models/token.py", template, config);
    }

    private static ActionResult tokenCrud(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        if (config.orm().isEmpty()) {
            return ActionResult.skipped("token CRUD needs SQLModel or SQLAlchemy");
        }
        return emit(writer, "app/crud/token.py", "auth/token_crud.py.tmpl", config);
    }

    private static ActionResult authService(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        String template = config.authMode() == AuthMode.COMPLETE
            ? "auth/auth_service_complete.py.tmpl"
            : "auth/auth_service_basic.py.tmpl";
        return emit(writer, "app/services/auth.py", template, config);
    }

    private static ActionResult emailTemplates(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        writer.createDirectories("app/templates/email");
        emit(writer, "app/templates/email/verification.html", "auth/verification.html.tmpl", config);
        return emit(writer, "app/templates/email/password_reset.html", "auth/password_reset.html.tmpl", config);
    }
}
