package my.companyprofile.app.model;

public enum TableOrientation {
	HORIZONTAL,
	VERTICAL
}
