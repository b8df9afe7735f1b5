package br.ufmg.cs.systems.chemgraph.molecule;

import br.ufmg.cs.systems.chemgraph.graph.GraphConstructionException;

/**
 * An atom whose element and bonding pattern correspond to no atom type.
 */
public class AtomTypeException extends GraphConstructionException {
   public AtomTypeException(String message) {
      super(message);
   }
}
