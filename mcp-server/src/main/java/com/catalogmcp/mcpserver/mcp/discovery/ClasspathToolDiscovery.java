package com.catalogmcp.mcpserver.mcp.discovery;

import com.catalogmcp.shared.mcp.errors.ConfigurationException;
import com.catalogmcp.shared.mcp.tools.McpTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.type.ClassMetadata;
import org.springframework.core.type.classreading.CachingMetadataReaderFactory;
import org.springframework.core.type.classreading.MetadataReaderFactory;
import org.springframework.util.ClassUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scans a package for classes named {@code *<suffix>} and instantiates the concrete
 * {@link McpTool} implementations among them.
 *
 * <p>Each class is initialised when loaded, which runs its metadata definition. Classes are
 * visited in name order. Classes that fail to load or instantiate are logged and skipped.
 */
@Slf4j
public class ClasspathToolDiscovery implements ToolDiscovery {

    public static final String DEFAULT_SUFFIX = "Tool";

    private final String basePackage;
    private final String classNameSuffix;
    private final ClassLoader classLoader;
    private final ResourcePatternResolver resourceResolver;
    private final MetadataReaderFactory metadataReaderFactory;

    public ClasspathToolDiscovery(String basePackage, String classNameSuffix) {
        this(basePackage, classNameSuffix, ClassUtils.getDefaultClassLoader());
    }

    public ClasspathToolDiscovery(String basePackage, String classNameSuffix, ClassLoader classLoader) {
        this.basePackage = basePackage;
        this.classNameSuffix = classNameSuffix == null || classNameSuffix.isEmpty() ? DEFAULT_SUFFIX : classNameSuffix;
        this.classLoader = classLoader;
        this.resourceResolver = new PathMatchingResourcePatternResolver(classLoader);
        this.metadataReaderFactory = new CachingMetadataReaderFactory(resourceResolver);
    }

    @Override
    public List<ToolCandidate> discover() {
        List<ToolCandidate> tools = new ArrayList<>();
        for (String className : scanClassNames()) {
            try {
                Class<?> type = Class.forName(className, true, classLoader);
                if (!McpTool.class.isAssignableFrom(type)) {
                    log.debug("Ignoring {}: not an McpTool", className);
                    continue;
                }
                McpTool tool = (McpTool) BeanUtils.instantiateClass(type);
                tools.add(new ToolCandidate(tool, className));
            } catch (ClassNotFoundException | LinkageError | BeanInstantiationException e) {
                log.warn("Skipping tool class {}: {}", className, e.getMessage());
            }
        }
        log.debug("Classpath scan of {} found {} tool(s)", basePackage, tools.size());
        return tools;
    }

    @Override
    public String getName() {
        return "classpath:" + basePackage;
    }

    private Iterable<String> scanClassNames() {
        String pattern = ResourcePatternResolver.CLASSPATH_ALL_URL_PREFIX
            + ClassUtils.convertClassNameToResourcePath(basePackage) + "/**/*" + classNameSuffix + ".class";
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(pattern);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to scan for tool classes in " + basePackage,
                Map.of("pattern", pattern, "reason", String.valueOf(e.getMessage())));
        }

        Map<String, Resource> byClassName = new TreeMap<>();
        for (Resource resource : resources) {
            try {
                ClassMetadata classMetadata = metadataReaderFactory.getMetadataReader(resource).getClassMetadata();
                if (classMetadata.isConcrete() && classMetadata.isIndependent()) {
                    byClassName.put(classMetadata.getClassName(), resource);
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable class resource {}: {}", resource, e.getMessage());
            }
        }
        return byClassName.keySet();
    }
}
