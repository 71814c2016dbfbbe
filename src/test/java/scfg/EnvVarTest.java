package scfg;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeFalse;

import org.junit.Test;

public class EnvVarTest {

  @Test
  public void parseInt_withoutValue_fallsBackToTheDefault() {
    assertThat(EnvVar.SCFG_ROUND_FACTOR.parseInt(null, 8), is(8));
  }

  @Test
  public void parseInt_trimsTheValue() {
    assertThat(EnvVar.SCFG_ROUND_FACTOR.parseInt(" 3\n", 8), is(3));
  }

  @Test
  public void parseInt_ofGarbage_namesTheVariableAndWhatItIsFor() {
    try {
      EnvVar.SCFG_ROUND_FACTOR.parseInt("lots", 8);
      fail("Expected a RestructuringError");
    } catch (RestructuringError e) {
      assertThat(e.getMessage(), containsString("SCFG_ROUND_FACTOR"));
      assertThat(e.getMessage(), containsString("\"lots\""));
      assertThat(e.getMessage(), containsString(EnvVar.SCFG_ROUND_FACTOR.description));
    }
  }

  @Test
  public void intValue_ofAnUnsetVariable_isTheDefault() {
    assumeFalse(EnvVar.SCFG_ROUND_FACTOR.isAvailable());

    assertThat(EnvVar.SCFG_ROUND_FACTOR.intValue(42), is(42));
    assertThat(EnvVar.SCFG_ROUND_FACTOR.isSetToOne(), is(false));
  }
}
