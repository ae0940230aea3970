package com.scaffold.generator.codegen.stack;

import java.util.Locale;
import java.util.Map;

import com.scaffold.generator.codegen.context.DjangoContextExtension;
import com.scaffold.generator.codegen.context.FastApiContextExtension;

/**
 * Built-in stack descriptors. Adding a stack means adding a descriptor here.
 *
 * Unknown stacks get the FastAPI layout under their own name with a generic
 * fallback component list.
 */
public class StackDescriptors {

    public static final String FASTAPI = "fastapi";
    public static final String DJANGO = "django";

    private static final StackDescriptor FASTAPI_STACK = fastApiLayout(FASTAPI)
            .fallbackComponent("models")
            .fallbackComponent("schemas")
            .fallbackComponent("crud")
            .fallbackComponent("router")
            .fallbackComponent("main")
            .fallbackComponent("db")
            .build();

    private static final StackDescriptor DJANGO_STACK = StackDescriptor.builder()
            .name(DJANGO)
            .single("models", "apps/core/models.py")
            .single("serializers", "apps/core/serializers.py")
            .single("viewsets", "apps/core/viewsets.py")
            .single("urls", "apps/core/urls.py")
            .single("admin", "apps/core/admin.py")
            .fallbackComponent("models")
            .fallbackComponent("serializers")
            .fallbackComponent("viewsets")
            .fallbackComponent("urls")
            .fallbackComponent("admin")
            .packageMarker("apps/__init__.py")
            .packageMarker("apps/core/__init__.py")
            .contextExtension(new DjangoContextExtension())
            .build();

    private static final Map<String, StackDescriptor> BUILT_IN = Map.of(
            FASTAPI, FASTAPI_STACK,
            DJANGO, DJANGO_STACK);

    private StackDescriptors() {
        // Utility class
    }

    public static StackDescriptor forStack(String stack) {
        String key = stack.toLowerCase(Locale.ROOT);
        StackDescriptor known = BUILT_IN.get(key);
        if (known != null) {
            return known;
        }
        return fastApiLayout(key)
                .fallbackComponent("models")
                .fallbackComponent("schemas")
                .fallbackComponent("crud")
                .fallbackComponent("router")
                .build();
    }

    public static boolean isBuiltIn(String stack) {
        return BUILT_IN.containsKey(stack.toLowerCase(Locale.ROOT));
    }

    private static StackDescriptor.StackDescriptorBuilder fastApiLayout(String name) {
        return StackDescriptor.builder()
                .name(name)
                .single("models", "app/models.py")
                .single("schemas", "app/schemas.py")
                .single("main", "app/main.py")
                .single("db", "app/database.py")
                .perEntity("crud", "app/crud/{entity}_crud.py")
                .perEntity("router", "app/routers/{entity}_router.py")
                .packageMarker("app/__init__.py")
                .packageMarker("app/crud/__init__.py")
                .packageMarker("app/routers/__init__.py")
                .contextExtension(new FastApiContextExtension());
    }
}
