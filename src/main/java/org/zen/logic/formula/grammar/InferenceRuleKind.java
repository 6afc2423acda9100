package org.zen.logic.formula.grammar;

/**
 * Rule tag carried by an inference-step {@link FormulaProofMarker}.
 */
public enum InferenceRuleKind
{
  /**
   * P → Q, P ⊢ Q
   */
  MODUS_PONENS("modus_ponens"),

  /**
   * P → Q, ¬Q ⊢ ¬P
   */
  MODUS_TOLLENS("modus_tollens"),

  /**
   * ∀x B ⊢ B
   */
  UNIVERSAL_INSTANTIATION("universal_instantiation"),

  /**
   * A ⊢ A, for an axiom A.
   */
  AXIOM("axiom"),

  /**
   * A rule the engine does not implement.  Never matches.
   */
  UNKNOWN("unknown");

  private final String mName;

  private InferenceRuleKind(String xiName)
  {
    mName = xiName;
  }

  /**
   * @return the name scripts use for this rule.
   */
  public String getName()
  {
    return mName;
  }

  /**
   * @return whether this is one of the rules that can justify a proof.
   */
  public boolean isSound()
  {
    return this != UNKNOWN;
  }

  /**
   * @return the rule with the specified script name, or {@link #UNKNOWN}.
   *
   * @param xiName - the name.
   */
  public static InferenceRuleKind fromName(String xiName)
  {
    for (InferenceRuleKind lKind : values())
    {
      if (lKind.mName.equals(xiName))
      {
        return lKind;
      }
    }
    return UNKNOWN;
  }
}
