package datamigrator.definition;

import datamigrator.exceptions.DefinitionNotFoundException;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scans the classpath for classes annotated with {@link MigrationComponent}.
 *
 * <h2>Usage:</h2>
 * <pre>
 * // Scan one package using the default classloader
 * Set&lt;Class&lt;?&gt;&gt; types = DefinitionScanner.scan("com.acme.upgrade");
 *
 * // Scan the whole classpath of a specific classloader
 * Set&lt;Class&lt;?&gt;&gt; types = DefinitionScanner.scan(myClassLoader, null);
 * </pre>
 *
 * @see datamigrator.engine.ComponentResolver
 */
public final class DefinitionScanner {

    private static final Logger log = LoggerFactory.getLogger(DefinitionScanner.class);

    private DefinitionScanner() {}

    /**
     * Scans a package using the default classloader.
     *
     * @param packagePrefix the package to scan, or null for the whole classpath
     * @return the annotated classes
     * @throws DefinitionNotFoundException if none is found
     */
    public static Set<Class<?>> scan(String packagePrefix) {
        return scan(null, packagePrefix);
    }

    /**
     * Scans the classpath of a classloader.
     *
     * @param classLoader the classloader to scan, or null for default
     * @param packagePrefix the package to scan, or null for the whole classpath
     * @return the annotated classes
     * @throws DefinitionNotFoundException if none is found
     */
    public static Set<Class<?>> scan(ClassLoader classLoader, String packagePrefix) {
        ConfigurationBuilder config = new ConfigurationBuilder()
                .addScanners(Scanners.TypesAnnotated);

        List<URL> urls = new ArrayList<>();
        if (packagePrefix != null) {
            urls.addAll(classLoader != null
                    ? ClasspathHelper.forPackage(packagePrefix, classLoader)
                    : ClasspathHelper.forPackage(packagePrefix));
            config.filterInputsBy(new FilterBuilder().includePackage(packagePrefix));
        } else {
            urls.addAll(ClasspathHelper.forJavaClassPath());
            if (classLoader != null) {
                urls.addAll(ClasspathHelper.forClassLoader(classLoader));
            }
        }
        if (classLoader != null) {
            config.addClassLoaders(classLoader);
        }
        config.setUrls(urls);

        Set<Class<?>> types = new Reflections(config).getTypesAnnotatedWith(MigrationComponent.class);
        if (types.isEmpty()) {
            throw new DefinitionNotFoundException("No @MigrationComponent found"
                    + (packagePrefix != null ? " in package " + packagePrefix : ""));
        }
        log.debug("Found {} migration definitions: {}", types.size(), types);
        return types;
    }
}
