package bulkdispatch.memory;

import bulkdispatch.model.Template;
import bulkdispatch.spi.TemplateStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryTemplateStore implements TemplateStore {
  private final Map<String, Template> templates = new ConcurrentHashMap<>();

  public InMemoryTemplateStore put(Template template) {
    templates.put(template.id(), template);
    return this;
  }

  public boolean remove(String templateId) {
    return templates.remove(templateId) != null;
  }

  public List<Template> list() {
    return List.copyOf(templates.values());
  }

  @Override
  public Optional<Template> get(String templateId) {
    return Optional.ofNullable(templates.get(templateId));
  }
}
