package bulkdispatch.spi;

import bulkdispatch.model.Template;

import java.util.Optional;

public interface TemplateStore {

  Optional<Template> get(String templateId);
}
