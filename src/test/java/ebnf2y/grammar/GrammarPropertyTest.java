package ebnf2y.grammar;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;

import org.junit.runner.RunWith;

import ebnf2y.generator.SkeletonGenerator;
import ebnf2y.reader.EbnfReader;
import ebnf2y.transform.Desugarer;
import ebnf2y.transform.Inliner;
import ebnf2y.transform.InliningLevel;

import static ebnf2y.grammar.RandomGrammars.START;
import static org.junit.jupiter.api.Assertions.*;

@RunWith(JUnitQuickcheck.class)
public class GrammarPropertyTest {

	@Property(trials = 200)
	public void printedGrammarReadsBack(@From(RandomGrammars.class) Grammar grammar){
		assertEquals(grammar, EbnfReader.read(GrammarPrinter.print(grammar)));
	}

	@Property(trials = 200)
	public void desugaredGrammarIsBnf(@From(RandomGrammars.class) Grammar grammar){
		Grammar bnf = Desugarer.desugar(grammar, START).grammar;
		assertTrue(bnf.isBnf(), bnf::toString);
		bnf.verify();
		assertTrue(bnf.hasProduction(START));
	}

	@Property(trials = 200)
	public void usedOnceInliningReachesFixedPoint(@From(RandomGrammars.class) Grammar grammar){
		Grammar inlined = Inliner.inline(Desugarer.desugar(grammar, START).grammar, InliningLevel.USED_ONCE, START);
		inlined.verify();
		for (Production production : inlined.getProductions()) {
			if (Inliner.isEligible(inlined, production, START)){
				assertNotEquals(1, inlined.referenceCount(production.name), inlined::toString);
			}
		}
	}

	@Property(trials = 200)
	public void selfReferentialProductionsAreNoCandidates(@From(RandomGrammars.class) Grammar grammar){
		Grammar bnf = Desugarer.desugar(grammar, START).grammar;
		for (String candidate : Inliner.candidates(bnf, START)) {
			assertFalse(bnf.getProduction(candidate).isSelfReferential(), candidate);
		}
		for (Production production : bnf.getProductions()) {
			if (production.isSelfReferential()){
				assertFalse(Inliner.candidates(bnf, START).contains(production.name));
			}
		}
	}

	@Property(trials = 100)
	public void generatorIsDeterministic(@From(RandomGrammars.class) Grammar grammar){
		Grammar bnf = Desugarer.desugar(grammar, START).grammar;
		assertEquals(new SkeletonGenerator("_").generate(bnf, START), new SkeletonGenerator("_").generate(bnf, START));
	}
}
