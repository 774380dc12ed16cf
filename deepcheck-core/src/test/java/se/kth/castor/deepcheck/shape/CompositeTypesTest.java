package se.kth.castor.deepcheck.shape;

import static org.assertj.core.api.Assertions.assertThat;

import examples.PojoWithAnnotatedFields;
import examples.PojoWithEnumField.Peano;
import examples.RecordWithHiddenComponent;
import examples.SimplePojoWithInheritance;
import examples.TrivialPojo;
import java.util.ArrayList;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CompositeTypesTest {

  @Test
  void testPublicFieldsAreExported() {
    CompositeType type = CompositeTypes.lookup(TrivialPojo.class).orElseThrow();

    assertThat(type.fields()).extracting(FieldDescriptor::name)
        .containsExactly("name", "count", "secret");
    assertThat(type.exportedFields()).extracting(FieldDescriptor::name)
        .containsExactly("name", "count");
    assertThat(type.isRecord()).isFalse();
  }

  @Test
  void testAnnotationsOverrideVisibility() {
    CompositeType type = CompositeTypes.lookup(PojoWithAnnotatedFields.class).orElseThrow();

    assertThat(type.exportedFields()).extracting(FieldDescriptor::name)
        .containsExactly("id");
  }

  @Test
  void testSuperclassFieldsComeFirst() {
    CompositeType type = CompositeTypes.lookup(SimplePojoWithInheritance.Subclass.class)
        .orElseThrow();

    assertThat(type.fields()).extracting(FieldDescriptor::name)
        .containsExactly("inherited", "inheritedSecret", "own");
    assertThat(type.fields()).extracting(FieldDescriptor::declaringClass)
        .containsExactly(
            SimplePojoWithInheritance.class,
            SimplePojoWithInheritance.class,
            SimplePojoWithInheritance.Subclass.class
        );
  }

  @Test
  void testRecordComponentsAreExported() {
    CompositeType type = CompositeTypes.lookup(RecordWithHiddenComponent.class).orElseThrow();

    assertThat(type.isRecord()).isTrue();
    assertThat(type.canonicalConstructor().getParameterCount()).isEqualTo(3);
    assertThat(type.exportedFields()).extracting(FieldDescriptor::name)
        .containsExactly("name", "score");
  }

  @Test
  void testPlatformAndEnumTypesHaveNoCompositeView() {
    assertThat(CompositeTypes.lookup(UUID.class)).isEmpty();
    assertThat(CompositeTypes.lookup(ArrayList.class)).isEmpty();
    assertThat(CompositeTypes.lookup(Peano.class)).isEmpty();
    assertThat(CompositeTypes.isPlatformType(String.class)).isTrue();
    assertThat(CompositeTypes.isPlatformType(TrivialPojo.class)).isFalse();
  }

  @Test
  void testLookupIsCached() {
    assertThat(CompositeTypes.lookup(TrivialPojo.class).orElseThrow())
        .isSameAs(CompositeTypes.lookup(TrivialPojo.class).orElseThrow());
  }

  @Test
  void testFieldDescriptorReadsPrivateFields() {
    CompositeType type = CompositeTypes.lookup(TrivialPojo.class).orElseThrow();
    FieldDescriptor secret = type.fields().get(2);

    assertThat(secret.read(new TrivialPojo("a", 1, "hush"))).isEqualTo("hush");
    assertThat(secret.toString()).endsWith("TrivialPojo#secret (not exported)");
  }
}
