package com.gentoro.agentrelay.prompt.impl;

import com.gentoro.agentrelay.exception.PromptException;
import com.gentoro.agentrelay.prompt.PromptRepository;
import com.gentoro.agentrelay.prompt.PromptTemplate;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Loads prompt YAML templates from the classpath starting at a base directory. Example basePath:
 * "prompts" (resolves resources like "prompts/synthesis.yaml").
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;

    String resource = resolveExisting(id);
    if (resource == null) {
      throw new PromptException("Prompt not found on classpath: " + basePath + "/" + id);
    }

    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new PromptException("Prompt resource not found: " + resource);
      }
      return PromptYamlParser.parse(id, new String(is.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new PromptException("Failed to read prompt file: " + name, e);
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
