package se.kth.castor.deepcheck.documents;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * YAML documents are compared like JSON ones. An empty document is {@code null}.
 */
public class YamlEquivalence extends DocumentEquivalence {

  public YamlEquivalence() {
    super(new YAMLMapper());
  }

  @Override
  protected boolean acceptsEmptyDocument() {
    return true;
  }
}
