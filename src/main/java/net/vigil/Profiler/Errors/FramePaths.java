package net.vigil.Profiler.Errors;

import lombok.experimental.UtilityClass;
import org.springframework.lang.Nullable;

/*
    PATH HELPERS USED BY LocationFinder
 */
@UtilityClass
public class FramePaths {

    /**
     * Builds the source path of a frame from its declaring class and source file name.
     * {@code com.acme.shop.OrderService$1} in {@code OrderService.java} becomes
     * {@code com/acme/shop/OrderService.java}. Classes compiled without debug
     * information fall back to the top-level class name.
     */
    public String sourcePath(String className, @Nullable String fileName) {
        int lastDot = className.lastIndexOf('.');
        String simpleName = lastDot >= 0 ? className.substring(lastDot + 1) : className;
        if (fileName == null) {
            int nested = simpleName.indexOf('$');
            fileName = (nested > 0 ? simpleName.substring(0, nested) : simpleName) + ".java";
        }
        if (lastDot < 0) {
            return fileName;
        }
        return className.substring(0, lastDot).replace('.', '/') + "/" + fileName;
    }

    /**
     * Normalizes an application root given either as a package ({@code com.acme.shop})
     * or a path ({@code com/acme/shop/}) to the path form without trailing slash.
     *
     * @return the normalized root, or null when blank
     */
    @Nullable
    public String normalizeRoot(@Nullable String appRoot) {
        if (appRoot == null || appRoot.isBlank()) {
            return null;
        }
        String root = appRoot.trim().replace('\\', '/');
        if (!root.contains("/")) {
            root = root.replace('.', '/');
        }
        while (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        while (root.startsWith("/")) {
            root = root.substring(1);
        }
        return root.isEmpty() ? null : root;
    }
}
