package com.gentoro.agentrelay.prompt.impl;

import com.gentoro.agentrelay.exception.PromptException;
import com.gentoro.agentrelay.prompt.PromptRepository;
import com.gentoro.agentrelay.prompt.PromptTemplate;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Loads prompt YAML templates from a directory, so operators can edit prompts without a build. */
public class FileSystemPromptRepository implements PromptRepository {
  private final Path path;

  public FileSystemPromptRepository(Path path) {
    this.path = path;
  }

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;
    Path yamlPath = resolveExisting(id);
    if (yamlPath == null) {
      throw new PromptException("Prompt not found: " + path.resolve(id));
    }
    try {
      return PromptYamlParser.parse(id, Files.readString(yamlPath));
    } catch (IOException e) {
      throw new PromptException("Failed to read prompt file: " + yamlPath, e);
    }
  }

  private Path resolveExisting(String id) {
    Path yaml = path.resolve(id + ".yaml");
    if (Files.isRegularFile(yaml)) return yaml;
    Path yml = path.resolve(id + ".yml");
    if (Files.isRegularFile(yml)) return yml;
    return null;
  }
}
